package com.chatguard.nlp.cache;

import com.chatguard.api.repository.ConfigurationUnavailableException;
import com.chatguard.api.repository.KeywordSourceException;
import com.chatguard.nlp.ahocorasick.AhoCorasick;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class MatcherCacheTest {

    static class FakeTicker extends Ticker {
        private long nanos = 0;

        @Override
        public synchronized long read() {
            return nanos;
        }

        synchronized void advance(Duration duration) {
            nanos += duration.toNanos();
        }
    }

    /** Serves whatever keywords it was last given and counts the fetches. */
    static class SwitchableSource implements KeywordSource<String> {
        final AtomicInteger fetches = new AtomicInteger();
        volatile List<KeywordEntry<String>> entries = ImmutableList.of();
        volatile KeywordSourceException failure = null;

        void serve(String... keywords) {
            List<KeywordEntry<String>> list = new ArrayList<>();
            for (String keyword : keywords) list.add(KeywordEntry.of(keyword, keyword));
            entries = list;
            failure = null;
        }

        @Override
        public List<KeywordEntry<String>> fetch() throws KeywordSourceException {
            fetches.incrementAndGet();
            if (failure != null) throw failure;
            return new ArrayList<>(entries);
        }
    }

    private FakeTicker ticker;
    private SwitchableSource source;

    @Before
    public void setUp() {
        ticker = new FakeTicker();
        source = new SwitchableSource();
    }

    private MatcherCache<String> newCache(CacheSettings settings) {
        return new MatcherCache<>("test", settings, ticker);
    }

    @Test
    public void servesCachedMatcherUntilTtlExpires() {
        MatcherCache<String> cache = newCache(CacheSettings.ofTtl(Duration.ofHours(1)));
        source.serve("old");

        AhoCorasick<String> first = cache.getOrBuild(source);
        assertEquals(1, first.search("old").size());

        source.serve("new");
        ticker.advance(Duration.ofMinutes(59));
        AhoCorasick<String> cached = cache.getOrBuild(source);
        assertSame(first, cached);
        assertTrue(cached.search("new").isEmpty());
        assertEquals(1, source.fetches.get());

        ticker.advance(Duration.ofMinutes(2));
        AhoCorasick<String> rebuilt = cache.getOrBuild(source);
        assertNotSame(first, rebuilt);
        assertEquals(1, rebuilt.search("new").size());
        assertTrue(rebuilt.search("old").isEmpty());
        assertEquals(2, source.fetches.get());
    }

    @Test
    public void identityCheckKeepsMatcherWhenKeywordsUnchanged() {
        CacheSettings settings = CacheSettings.ofTtl(Duration.ofMinutes(5)).withIdentityCheck(true);
        MatcherCache<String> cache = newCache(settings);
        source.serve("a", "b");

        AhoCorasick<String> first = cache.getOrBuild(source);
        ticker.advance(Duration.ofMinutes(6));
        source.serve("a", "b");
        assertSame(first, cache.getOrBuild(source));
        assertEquals(2, source.fetches.get());

        // The unchanged check also restarts the TTL.
        ticker.advance(Duration.ofMinutes(4));
        assertSame(first, cache.getOrBuild(source));
        assertEquals(2, source.fetches.get());

        ticker.advance(Duration.ofMinutes(2));
        source.serve("a", "c");
        AhoCorasick<String> changed = cache.getOrBuild(source);
        assertNotSame(first, changed);
        assertEquals(1, changed.search("c").size());
    }

    @Test
    public void rebuildsUnchangedKeywordsWithoutIdentityCheck() {
        MatcherCache<String> cache = newCache(CacheSettings.ofTtl(Duration.ofMinutes(5)));
        source.serve("a");

        AhoCorasick<String> first = cache.getOrBuild(source);
        ticker.advance(Duration.ofMinutes(6));
        assertNotSame(first, cache.getOrBuild(source));
    }

    @Test
    public void invalidateForcesRebuild() {
        MatcherCache<String> cache = newCache(CacheSettings.defaults());
        source.serve("a");
        cache.getOrBuild(source);
        assertTrue(cache.isCached());

        cache.invalidate();
        assertFalse(cache.isCached());
        assertFalse(cache.getLastBuildStats().isPresent());

        source.serve("b");
        assertEquals(1, cache.getOrBuild(source).search("b").size());
        assertEquals(2, source.fetches.get());
    }

    @Test
    public void missingConfigurationYieldsEmptyMatcherAndIsRetried() {
        MatcherCache<String> cache = newCache(CacheSettings.defaults());
        source.failure = new ConfigurationUnavailableException("no context");

        AhoCorasick<String> matcher = cache.getOrBuild(source);
        assertTrue(matcher.isEmpty());
        assertTrue(matcher.search("anything").isEmpty());
        assertFalse(cache.isCached());

        source.serve("back");
        assertEquals(1, cache.getOrBuild(source).search("back").size());
        assertEquals(2, source.fetches.get());
    }

    @Test
    public void failedRebuildServesStaleMatcher() {
        MatcherCache<String> cache = newCache(CacheSettings.ofTtl(Duration.ofMinutes(1)));
        source.serve("kept");
        AhoCorasick<String> first = cache.getOrBuild(source);

        ticker.advance(Duration.ofMinutes(2));
        source.failure = new KeywordSourceException("database down");
        assertSame(first, cache.getOrBuild(source));

        // Still stale, so the next call tries again.
        assertSame(first, cache.getOrBuild(source));
        assertEquals(3, source.fetches.get());
    }

    @Test
    public void runtimeFailureIsNotCached() {
        MatcherCache<String> cache = newCache(CacheSettings.defaults());
        KeywordSource<String> broken = () -> {
            throw new IllegalStateException("boom");
        };
        assertTrue(cache.getOrBuild(broken).isEmpty());
        assertFalse(cache.isCached());
    }

    @Test
    public void recordsBuildStats() {
        MatcherCache<String> cache = newCache(CacheSettings.defaults());
        assertFalse(cache.getLastBuildStats().isPresent());

        source.serve("ab", "ac");
        cache.getOrBuild(source);
        BuildStats stats = cache.getLastBuildStats().get();
        assertEquals(2, stats.getKeywordCount());
        assertEquals(4, stats.getStateCount());
        assertEquals(1, stats.getRootChildCount());
        assertTrue(stats.getBuildMillis() >= 0);
    }

    @Test
    public void caseSensitivityFollowsSettings() {
        MatcherCache<String> cache = newCache(CacheSettings.defaults().withCaseSensitive(true));
        source.serve("QQ");
        AhoCorasick<String> matcher = cache.getOrBuild(source);
        assertTrue(matcher.isCaseSensitive());
        assertTrue(matcher.search("qq").isEmpty());
    }

    @Test
    public void concurrentFirstCallsBuildOnce() throws Exception {
        final MatcherCache<String> cache = newCache(CacheSettings.defaults());
        source.serve("x");
        int threads = 8;
        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<AhoCorasick<String>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; ++i) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return cache.getOrBuild(source);
                }));
            }
            start.countDown();
            AhoCorasick<String> first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<AhoCorasick<String>> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, source.fetches.get());
    }

    @Test
    public void invalidateDuringRebuildIsNotLost() throws Exception {
        final MatcherCache<String> cache = newCache(CacheSettings.defaults());
        source.serve("old");
        final CountDownLatch fetched = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();
        final KeywordSource<String> slowFirstFetch = () -> {
            List<KeywordEntry<String>> entries = source.fetch();
            if (calls.incrementAndGet() == 1) {
                fetched.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return entries;
        };

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<AhoCorasick<String>> inFlight =
                executor.submit(() -> cache.getOrBuild(slowFirstFetch));
            assertTrue(fetched.await(10, TimeUnit.SECONDS));

            source.serve("new");
            cache.invalidate();
            release.countDown();

            // The in-flight caller still gets the matcher it built.
            assertEquals(1, inFlight.get(10, TimeUnit.SECONDS).search("old").size());
            assertFalse(cache.isCached());
        } finally {
            executor.shutdownNow();
        }

        AhoCorasick<String> current = cache.getOrBuild(slowFirstFetch);
        assertEquals(1, current.search("new").size());
        assertTrue(current.search("old").isEmpty());
        assertEquals(2, source.fetches.get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBlankDomain() {
        new MatcherCache<String>(" ", CacheSettings.defaults());
    }
}
