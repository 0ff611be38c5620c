package com.chatguard.api.data;

import com.chatguard.nlp.payload.GeoLocationPayload;
import com.google.gson.annotations.SerializedName;

/**
 * A place found in a message. Only the province, city and district fields
 * that apply to the matched level (and its ancestors) are filled in.
 */
public class GeoLocationMatch {
  private final long id;
  private final String type;
  private final String name;
  private final int level;
  @SerializedName("parent_id")
  private final Long parentId;
  @SerializedName("parent_name")
  private final String parentName;
  private final Double latitude;
  private final Double longitude;
  @SerializedName("keyword_matched")
  private final String keywordMatched;
  private final String province;
  private final String city;
  private final String district;

  public GeoLocationMatch(GeoLocationPayload payload, String keywordMatched,
                          String province, String city, String district) {
    this.id = payload.getId();
    this.type = payload.getType();
    this.name = payload.getName();
    this.level = payload.getLevel().getCode();
    this.parentId = payload.getParentId();
    this.parentName = payload.getParentName();
    this.latitude = payload.getLatitude();
    this.longitude = payload.getLongitude();
    this.keywordMatched = keywordMatched;
    this.province = province;
    this.city = city;
    this.district = district;
  }

  public String getCity() {
    return this.city;
  }

  public String getDistrict() {
    return this.district;
  }

  public long getId() {
    return this.id;
  }

  public String getKeywordMatched() {
    return this.keywordMatched;
  }

  public Double getLatitude() {
    return this.latitude;
  }

  public int getLevel() {
    return this.level;
  }

  public Double getLongitude() {
    return this.longitude;
  }

  public String getName() {
    return this.name;
  }

  public Long getParentId() {
    return this.parentId;
  }

  public String getParentName() {
    return this.parentName;
  }

  public String getProvince() {
    return this.province;
  }

  public String getType() {
    return this.type;
  }

  @Override
  public String toString() {
    return String.format("%s %s (\"%s\") [%s/%s/%s]", this.type, this.name,
                         this.keywordMatched, this.province, this.city,
                         this.district);
  }
}
