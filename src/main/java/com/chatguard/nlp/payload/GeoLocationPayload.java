package com.chatguard.nlp.payload;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A place and its resolved ancestors. The ancestor names are looked up once
 * when the matcher is built, so a match never needs another query to know
 * which province or city it sits in.
 */
public final class GeoLocationPayload implements MatchPayload {

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private long id;
    private String name;
    private GeoLevel level;
    private Long parentId;
    private String parentName;
    private String provinceName;
    private String cityName;
    private Double latitude;
    private Double longitude;

    private Builder() {
    }

    public GeoLocationPayload build() {
      return new GeoLocationPayload(this);
    }

    public Builder setCityName(String cityName) {
      this.cityName = cityName;
      return this;
    }

    public Builder setCoordinates(Double latitude, Double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
      return this;
    }

    public Builder setId(long id) {
      this.id = id;
      return this;
    }

    public Builder setLevel(GeoLevel level) {
      this.level = level;
      return this;
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setParent(Long parentId, String parentName) {
      this.parentId = parentId;
      this.parentName = parentName;
      return this;
    }

    public Builder setProvinceName(String provinceName) {
      this.provinceName = provinceName;
      return this;
    }
  }

  private final long id;
  private final String name;
  private final GeoLevel level;
  private final Long parentId;
  private final String parentName;
  private final String provinceName;  // Resolved province ancestor, if any.
  private final String cityName;      // Resolved city ancestor, if any.
  private final Double latitude;
  private final Double longitude;

  private GeoLocationPayload(Builder builder) {
    this.id = builder.id;
    this.name = checkNotNull(builder.name, "name cannot be null");
    this.level = checkNotNull(builder.level, "level cannot be null");
    this.parentId = builder.parentId;
    this.parentName = builder.parentName;
    this.provinceName = builder.provinceName;
    this.cityName = builder.cityName;
    this.latitude = builder.latitude;
    this.longitude = builder.longitude;
  }

  public String getCityName() {
    return this.cityName;
  }

  @Override
  public KeywordDomain getDomain() {
    return KeywordDomain.GEO_LOCATION;
  }

  public long getId() {
    return this.id;
  }

  public Double getLatitude() {
    return this.latitude;
  }

  public GeoLevel getLevel() {
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

  public String getProvinceName() {
    return this.provinceName;
  }

  public String getType() {
    return this.level.getType();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GeoLocationPayload)) return false;
    GeoLocationPayload that = (GeoLocationPayload) o;
    return this.id == that.id &&
           this.level == that.level &&
           this.name.equals(that.name) &&
           Objects.equal(this.parentId, that.parentId) &&
           Objects.equal(this.parentName, that.parentName) &&
           Objects.equal(this.provinceName, that.provinceName) &&
           Objects.equal(this.cityName, that.cityName) &&
           Objects.equal(this.latitude, that.latitude) &&
           Objects.equal(this.longitude, that.longitude);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.id, this.name, this.level, this.parentId,
                            this.parentName, this.provinceName, this.cityName,
                            this.latitude, this.longitude);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", this.id)
        .add("name", this.name)
        .add("type", getType())
        .add("parent", this.parentName)
        .toString();
  }
}
