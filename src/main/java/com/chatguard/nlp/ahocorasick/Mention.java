package com.chatguard.nlp.ahocorasick;

/**
 * An output entry of the automaton: the keyword exactly as it was added (not
 * case-folded) and the payload attached to it.
 */
public final class Mention<T> {

  private final String keyword;
  private final T payload;

  Mention(String keyword, T payload) {
    this.keyword = keyword;
    this.payload = payload;
  }

  public int getCharLength() {
    return this.keyword.length();
  }

  public String getKeyword() {
    return this.keyword;
  }

  public T getPayload() {
    return this.payload;
  }

  @Override
  public String toString() {
    return String.format("\"%s\" => %s", this.keyword, this.payload);
  }
}
