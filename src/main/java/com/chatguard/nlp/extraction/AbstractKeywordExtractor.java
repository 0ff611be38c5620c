package com.chatguard.nlp.extraction;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.cache.KeywordSource;
import com.chatguard.nlp.cache.MatcherCache;
import com.google.common.collect.ImmutableList;

/**
 * Runs the cached matcher of one keyword domain over a message and turns the
 * raw hits into domain results. Extraction never throws: blank text yields
 * nothing, and any error is logged and yields nothing as well.
 *
 * @param <P> payload type of the domain
 * @param <R> result type handed to callers
 */
public abstract class AbstractKeywordExtractor<P, R> {
  private static final Logger log = LoggerFactory.getLogger(AbstractKeywordExtractor.class);

  public static final double KEYWORD_CONFIDENCE = 0.9;

  private final MatcherCache<P> cache;
  private final KeywordSource<P> source;

  protected AbstractKeywordExtractor(MatcherCache<P> cache,
                                     KeywordSource<P> source) {
    this.cache = checkNotNull(cache, "cache cannot be null");
    this.source = checkNotNull(source, "source cannot be null");
  }

  public List<R> extract(String text) {
    if (StringUtils.isBlank(text)) return ImmutableList.of();
    try {
      return extractCore(getMatcher(), text);
    } catch (RuntimeException e) {
      log.error("Error extracting {} keywords: {}", this.cache.getDomain(),
                e.getMessage(), e);
      return ImmutableList.of();
    }
  }

  public MatcherCache<P> getCache() {
    return this.cache;
  }

  /** Drops the cached matcher; the next extraction rebuilds it. */
  public void refresh() {
    this.cache.invalidate();
  }

  protected AhoCorasick<P> getMatcher() {
    return this.cache.getOrBuild(this.source);
  }

  protected abstract List<R> extractCore(AhoCorasick<P> matcher, String text);
}
