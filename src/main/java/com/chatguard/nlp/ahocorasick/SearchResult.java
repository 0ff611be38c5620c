package com.chatguard.nlp.ahocorasick;

import com.google.common.base.Objects;
import com.google.common.collect.Range;

/**
 * A single keyword occurrence found by the automaton.
 */
public final class SearchResult<T> {
  private final String keyword;
  private final int position;
  private final T payload;

  SearchResult(Mention<T> mention, int lastIndex) {
    this(mention.getKeyword(), lastIndex - mention.getCharLength() + 1,
         mention.getPayload());
  }

  public SearchResult(String keyword, int position, T payload) {
    this.keyword = keyword;
    this.position = position;
    this.payload = payload;
  }

  /**
   * Returns the offset one char after the last matching character.
   */
  public int getEndOffset() {
    return this.position + this.keyword.length();
  }

  public String getKeyword() {
    return this.keyword;
  }

  public T getPayload() {
    return this.payload;
  }

  /**
   * Returns the 0-based char offset where the keyword starts in the scanned text.
   */
  public int getPosition() {
    return this.position;
  }

  public Range<Integer> getRange() {
    return Range.closedOpen(this.position, getEndOffset());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SearchResult)) return false;
    SearchResult<?> that = (SearchResult<?>) o;
    return this.position == that.position &&
           Objects.equal(this.keyword, that.keyword) &&
           Objects.equal(this.payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.keyword, this.position, this.payload);
  }

  @Override
  public String toString() {
    return String.format("%s \"%s\" => %s", getRange(), this.keyword,
                         this.payload);
  }
}
