package com.chatguard.nlp.cache;

import java.util.List;

import com.chatguard.api.repository.KeywordSourceException;

/**
 * Supplies the current keyword set of one domain. Called by
 * {@link MatcherCache} whenever its matcher has to be rebuilt.
 */
public interface KeywordSource<T> {
  public List<KeywordEntry<T>> fetch() throws KeywordSourceException;
}
