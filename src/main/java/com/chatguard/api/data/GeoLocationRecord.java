package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

/**
 * A row of the geo master table: a province, city or district.
 */
public class GeoLocationRecord {
  public long id;
  public int level;
  public String name;
  @SerializedName("parent_id")
  public Long parentId;
  public String code;
  public Double latitude;
  public Double longitude;
  // Comma separated, e.g. "Beijing,Jing,Yanjing".
  public String aliases;
  @SerializedName("short_name")
  public String shortName;
  @SerializedName("is_active")
  public boolean active = true;
}
