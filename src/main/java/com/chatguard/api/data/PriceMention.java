package com.chatguard.api.data;

import com.google.common.base.Objects;
import com.google.gson.annotations.SerializedName;

public class PriceMention {
  private final double value;
  private final String unit;
  @SerializedName("original_text")
  private final String originalText;
  private final double confidence;

  public PriceMention(double value, String unit, String originalText,
                      double confidence) {
    this.value = value;
    this.unit = unit;
    this.originalText = originalText;
    this.confidence = confidence;
  }

  public double getConfidence() {
    return this.confidence;
  }

  public String getOriginalText() {
    return this.originalText;
  }

  public String getUnit() {
    return this.unit;
  }

  public double getValue() {
    return this.value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PriceMention)) return false;
    PriceMention that = (PriceMention) o;
    return Double.compare(this.value, that.value) == 0 &&
           Objects.equal(this.unit, that.unit) &&
           Objects.equal(this.originalText, that.originalText);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.value, this.unit, this.originalText);
  }

  @Override
  public String toString() {
    return String.format("%.2f/%s (\"%s\")", this.value, this.unit,
                         this.originalText);
  }
}
