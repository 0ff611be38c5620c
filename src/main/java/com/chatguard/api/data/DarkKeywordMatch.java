package com.chatguard.api.data;

import com.chatguard.nlp.payload.DarkKeywordPayload;
import com.google.gson.annotations.SerializedName;

public class DarkKeywordMatch {
  private final String keyword;
  @SerializedName("drug_id")
  private final long drugId;
  @SerializedName("drug_name")
  private final String drugName;
  @SerializedName("category_id")
  private final long categoryId;
  @SerializedName("category_name")
  private final String categoryName;
  private final int weight;
  private final int count;
  private final double confidence;

  public DarkKeywordMatch(String keyword, DarkKeywordPayload payload, int count,
                          double confidence) {
    this.keyword = keyword;
    this.drugId = payload.getDrugId();
    this.drugName = payload.getDrugName();
    this.categoryId = payload.getCategoryId();
    this.categoryName = payload.getCategoryName();
    this.weight = payload.getWeight();
    this.count = count;
    this.confidence = confidence;
  }

  public long getCategoryId() {
    return this.categoryId;
  }

  public String getCategoryName() {
    return this.categoryName;
  }

  public double getConfidence() {
    return this.confidence;
  }

  /** Number of occurrences in the message, 1 unless counted. */
  public int getCount() {
    return this.count;
  }

  public long getDrugId() {
    return this.drugId;
  }

  public String getDrugName() {
    return this.drugName;
  }

  public String getKeyword() {
    return this.keyword;
  }

  public int getWeight() {
    return this.weight;
  }

  @Override
  public String toString() {
    return String.format("\"%s\" x%d => %s/%s (w%d)", this.keyword, this.count,
                         this.categoryName, this.drugName, this.weight);
  }
}
