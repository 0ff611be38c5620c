package com.chatguard.nlp.cache;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chatguard.api.repository.ConfigurationUnavailableException;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.chatguard.nlp.ahocorasick.AhoCorasickBuilder;
import com.chatguard.utils.ProcessUtil;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;

/**
 * Holds the finalized matcher of one keyword domain and rebuilds it from a
 * {@link KeywordSource} once it is older than the configured TTL.
 *
 * <p>Rebuilds are serialized by a per-cache lock. While a stale matcher
 * exists, the caller that wins the lock rebuilds and everybody else keeps
 * searching the stale one. When nothing has been built yet, callers wait for
 * the single build in flight.</p>
 *
 * <p>Failures never reach the caller: if the source is unavailable or throws,
 * the previous matcher (or an empty one) is returned and nothing is cached, so
 * the next call tries again.</p>
 *
 * <p>{@link #invalidate} bumps a generation counter. A rebuild that started
 * under an older generation hands its matcher to its caller but does not
 * install it.</p>
 */
public class MatcherCache<T> {
  private static final Logger log = LoggerFactory.getLogger(MatcherCache.class);

  private static final class CacheEntry<T> {
    final AhoCorasick<T> automaton;
    final long builtAtNanos;
    final List<KeywordEntry<T>> source;
    final BuildStats stats;

    CacheEntry(AhoCorasick<T> automaton, long builtAtNanos,
               List<KeywordEntry<T>> source, BuildStats stats) {
      this.automaton = automaton;
      this.builtAtNanos = builtAtNanos;
      this.source = source;
      this.stats = stats;
    }
  }

  private final String domain;
  private final CacheSettings settings;
  private final Ticker ticker;
  private final ReentrantLock buildLock;
  private final AtomicLong generation;
  private volatile CacheEntry<T> entry;

  public MatcherCache(String domain, CacheSettings settings) {
    this(domain, settings, Ticker.systemTicker());
  }

  public MatcherCache(String domain, CacheSettings settings, Ticker ticker) {
    checkArgument(StringUtils.isNotBlank(domain), "Domain cannot be blank");
    this.domain = domain;
    this.settings = checkNotNull(settings, "settings cannot be null");
    this.ticker = checkNotNull(ticker, "ticker cannot be null");
    this.buildLock = new ReentrantLock();
    this.generation = new AtomicLong();
    this.entry = null;
  }

  public String getDomain() {
    return this.domain;
  }

  public Optional<BuildStats> getLastBuildStats() {
    CacheEntry<T> current = this.entry;
    return (current == null) ? Optional.empty() : Optional.of(current.stats);
  }

  /**
   * Returns the cached matcher if it is still within its TTL, otherwise
   * fetches the keywords from {@code source} and builds a new one.
   */
  public AhoCorasick<T> getOrBuild(KeywordSource<T> source) {
    checkNotNull(source, "source cannot be null");

    CacheEntry<T> current = this.entry;
    if (current != null && isFresh(current)) {
      log.debug("Using cached {} matcher", this.domain);
      return current.automaton;
    }

    if (current != null) {
      // Someone else is rebuilding; keep serving the stale matcher meanwhile.
      if (!this.buildLock.tryLock()) return current.automaton;
    } else {
      this.buildLock.lock();
    }
    try {
      current = this.entry;
      if (current != null && isFresh(current)) return current.automaton;
      return rebuild(source, current);
    } finally {
      this.buildLock.unlock();
    }
  }

  /**
   * Drops the cached matcher so that the next {@link #getOrBuild} rebuilds it.
   * Call after the keyword configuration of this domain was edited.
   */
  public void invalidate() {
    synchronized (this.generation) {
      this.generation.incrementAndGet();
      this.entry = null;
    }
    log.info("{} matcher cache cleared", this.domain);
  }

  public boolean isCached() {
    return this.entry != null;
  }

  private AhoCorasick<T> fallback(CacheEntry<T> previous) {
    if (previous != null) return previous.automaton;
    return AhoCorasick.empty(this.settings.isCaseSensitive());
  }

  // Checked and installed under the same monitor invalidate() uses.
  private void install(long startGeneration, CacheEntry<T> built) {
    synchronized (this.generation) {
      if (this.generation.get() != startGeneration) {
        log.info("{} matcher invalidated during rebuild, not caching it",
                 this.domain);
        return;
      }
      this.entry = built;
    }
  }

  private boolean isFresh(CacheEntry<T> current) {
    long ageNanos = this.ticker.read() - current.builtAtNanos;
    return ageNanos < this.settings.getTtl().toNanos();
  }

  private AhoCorasick<T> rebuild(KeywordSource<T> source,
                                 CacheEntry<T> previous) {
    long startGeneration = this.generation.get();
    try {
      List<KeywordEntry<T>> entries = ImmutableList.copyOf(source.fetch());

      if (this.settings.isIdentityCheck() && previous != null &&
          entries.equals(previous.source)) {
        log.debug("{} keywords unchanged, keeping cached matcher", this.domain);
        install(startGeneration, new CacheEntry<>(
            previous.automaton, this.ticker.read(), previous.source,
            previous.stats));
        return previous.automaton;
      }

      log.info("Building {} matcher with {} keywords", this.domain,
               entries.size());
      Stopwatch stopwatch = Stopwatch.createStarted();
      AhoCorasickBuilder<T> builder =
          new AhoCorasickBuilder<>(this.settings.isCaseSensitive());
      for (KeywordEntry<T> keywordEntry : entries) {
        builder.add(keywordEntry.getKeyword(), keywordEntry.getPayload());
      }
      AhoCorasick<T> automaton = builder.build();

      BuildStats stats = BuildStats.of(
          automaton, stopwatch.elapsed(TimeUnit.MILLISECONDS));
      install(startGeneration,
              new CacheEntry<>(automaton, this.ticker.read(), entries, stats));
      log.info("{} matcher built: {}, {}", this.domain, stats,
               ProcessUtil.getHeapConsumption());
      return automaton;
    } catch (ConfigurationUnavailableException e) {
      log.warn("No {} configuration available, matching nothing: {}",
               this.domain, e.getMessage());
      return fallback(previous);
    } catch (Exception e) {
      log.error("Error building {} matcher: {}", this.domain, e.getMessage(), e);
      return fallback(previous);
    }
  }
}
