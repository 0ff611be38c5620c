package com.chatguard.nlp.payload;

/** Administrative level of a place, as stored in the geo master table. */
public enum GeoLevel {
  PROVINCE(1, "province"),
  CITY(2, "city"),
  DISTRICT(3, "district");

  public static GeoLevel fromCode(int code) {
    for (GeoLevel level : values()) {
      if (level.code == code) return level;
    }
    throw new IllegalArgumentException("Unknown geo level: " + code);
  }

  private final int code;
  private final String type;

  GeoLevel(int code, String type) {
    this.code = code;
    this.type = type;
  }

  public int getCode() {
    return this.code;
  }

  public String getType() {
    return this.type;
  }
}
