package com.chatguard.api.data;

import com.google.gson.annotations.SerializedName;

public class TagMatch {
  @SerializedName("tag_id")
  private final long tagId;
  private final String keyword;
  @SerializedName("auto_focus")
  private final boolean autoFocus;
  @SerializedName("mapping_id")
  private final long mappingId;
  private final int position;

  public TagMatch(long tagId, String keyword, boolean autoFocus, long mappingId,
                  int position) {
    this.tagId = tagId;
    this.keyword = keyword;
    this.autoFocus = autoFocus;
    this.mappingId = mappingId;
    this.position = position;
  }

  public String getKeyword() {
    return this.keyword;
  }

  public long getMappingId() {
    return this.mappingId;
  }

  public int getPosition() {
    return this.position;
  }

  public long getTagId() {
    return this.tagId;
  }

  public boolean isAutoFocus() {
    return this.autoFocus;
  }

  @Override
  public String toString() {
    return String.format("tag %d \"%s\" @%d", this.tagId, this.keyword,
                         this.position);
  }
}
