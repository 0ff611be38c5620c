package com.chatguard.nlp.payload;

import com.google.common.base.Objects;

public final class TagKeywordPayload implements MatchPayload {
  private final long mappingId;
  private final long tagId;
  private final boolean autoFocus;  // Put matching users on the watch list.

  public TagKeywordPayload(long mappingId, long tagId, boolean autoFocus) {
    this.mappingId = mappingId;
    this.tagId = tagId;
    this.autoFocus = autoFocus;
  }

  @Override
  public KeywordDomain getDomain() {
    return KeywordDomain.TAG_KEYWORD;
  }

  public long getMappingId() {
    return this.mappingId;
  }

  public long getTagId() {
    return this.tagId;
  }

  public boolean isAutoFocus() {
    return this.autoFocus;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TagKeywordPayload)) return false;
    TagKeywordPayload that = (TagKeywordPayload) o;
    return this.mappingId == that.mappingId &&
           this.tagId == that.tagId &&
           this.autoFocus == that.autoFocus;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.mappingId, this.tagId, this.autoFocus);
  }

  @Override
  public String toString() {
    return String.format("tag=%d mapping=%d autoFocus=%s", this.tagId,
                         this.mappingId, this.autoFocus);
  }
}
