package com.chatguard.nlp.payload;

/** The keyword domains that each get their own matcher. */
public enum KeywordDomain {
  TRANSACTION_METHOD("transaction-method"),
  DARK_KEYWORD("dark-keyword"),
  GEO_LOCATION("geo-location"),
  TAG_KEYWORD("tag-keyword");

  private final String key;

  KeywordDomain(String key) {
    this.key = key;
  }

  /** Name used in log lines and configuration keys. */
  public String getKey() {
    return this.key;
  }
}
