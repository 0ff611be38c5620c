package com.chatguard.nlp.payload;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A restricted-substance keyword together with the drug and category it
 * belongs to.
 */
public final class DarkKeywordPayload implements MatchPayload {
  private final long keywordId;
  private final long drugId;
  private final String drugName;
  private final long categoryId;
  private final String categoryName;
  private final int weight;

  public DarkKeywordPayload(long keywordId, long drugId, String drugName,
                            long categoryId, String categoryName, int weight) {
    this.keywordId = keywordId;
    this.drugId = drugId;
    this.drugName = drugName;
    this.categoryId = categoryId;
    this.categoryName = categoryName;
    this.weight = weight;
  }

  public long getCategoryId() {
    return this.categoryId;
  }

  public String getCategoryName() {
    return this.categoryName;
  }

  @Override
  public KeywordDomain getDomain() {
    return KeywordDomain.DARK_KEYWORD;
  }

  public long getDrugId() {
    return this.drugId;
  }

  public String getDrugName() {
    return this.drugName;
  }

  public long getKeywordId() {
    return this.keywordId;
  }

  public int getWeight() {
    return this.weight;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DarkKeywordPayload)) return false;
    DarkKeywordPayload that = (DarkKeywordPayload) o;
    return this.keywordId == that.keywordId &&
           this.drugId == that.drugId &&
           this.categoryId == that.categoryId &&
           this.weight == that.weight &&
           Objects.equal(this.drugName, that.drugName) &&
           Objects.equal(this.categoryName, that.categoryName);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.keywordId, this.drugId, this.drugName,
                            this.categoryId, this.categoryName, this.weight);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("drug", this.drugName)
        .add("category", this.categoryName)
        .add("weight", this.weight)
        .toString();
  }
}
