package com.chatguard.nlp.source;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.nlp.cache.KeywordEntry;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.payload.KeywordDomain;
import com.google.common.base.Stopwatch;

/**
 * Base class of the adapters that turn configuration rows into keyword
 * entries. Subclasses only read rows and emit entries; timing and logging
 * live here.
 */
public abstract class AbstractKeywordSource<T> implements KeywordSource<T> {
  private static final Logger log = LoggerFactory.getLogger(AbstractKeywordSource.class);

  private final KeywordDomain domain;

  protected AbstractKeywordSource(KeywordDomain domain) {
    this.domain = checkNotNull(domain, "domain cannot be null");
  }

  @Override
  public final List<KeywordEntry<T>> fetch() throws KeywordSourceException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<KeywordEntry<T>> entries = new ArrayList<>();
    collect(entries);
    log.debug("Fetched {} {} keywords in {}", entries.size(),
              this.domain.getKey(), stopwatch);
    return entries;
  }

  public KeywordDomain getDomain() {
    return this.domain;
  }

  /**
   * Adds the entry unless the keyword is blank. Keywords are trimmed.
   */
  protected static <T> boolean addKeyword(List<KeywordEntry<T>> entries,
                                          String keyword, T payload) {
    if (StringUtils.isBlank(keyword)) return false;
    entries.add(KeywordEntry.of(keyword.trim(), payload));
    return true;
  }

  /**
   * Reads the active configuration rows and appends one entry per keyword.
   */
  protected abstract void collect(List<KeywordEntry<T>> entries)
      throws KeywordSourceException;
}
