package com.chatguard.api.data;

public class TransactionMethodMatch {
  private final String method;
  private final String keyword;
  private final double confidence;

  public TransactionMethodMatch(String method, String keyword, double confidence) {
    this.method = method;
    this.keyword = keyword;
    this.confidence = confidence;
  }

  public double getConfidence() {
    return this.confidence;
  }

  public String getKeyword() {
    return this.keyword;
  }

  public String getMethod() {
    return this.method;
  }

  @Override
  public String toString() {
    return String.format("%s (\"%s\")", this.method, this.keyword);
  }
}
