package com.chatguard.nlp.cache;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

/**
 * One keyword to load into a matcher, with the payload reported when it is
 * found. Two entries are equal when keyword and payload are equal, which is
 * what the cache compares when checking whether a source changed.
 */
public final class KeywordEntry<T> {

  public static <T> KeywordEntry<T> of(String keyword, T payload) {
    return new KeywordEntry<>(keyword, payload);
  }

  private final String keyword;
  private final T payload;

  private KeywordEntry(String keyword, T payload) {
    this.keyword = checkNotNull(keyword, "keyword cannot be null");
    this.payload = payload;
  }

  public String getKeyword() {
    return this.keyword;
  }

  public T getPayload() {
    return this.payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof KeywordEntry)) return false;
    KeywordEntry<?> that = (KeywordEntry<?>) o;
    return this.keyword.equals(that.keyword) &&
           Objects.equal(this.payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.keyword, this.payload);
  }

  @Override
  public String toString() {
    return String.format("\"%s\" => %s", this.keyword, this.payload);
  }
}
