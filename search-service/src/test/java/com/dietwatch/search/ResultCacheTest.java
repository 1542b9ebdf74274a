package com.dietwatch.search;

import com.dietwatch.search.model.CacheEntry;
import com.dietwatch.search.model.CacheStats;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.service.ResultCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));

    @Test
    void testServesEntryUntilTtlElapses() {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 100, clock);
        cache.put("sig", List.of(new ScoredHit("B1", 0.9)));

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(cache.get("sig")).isNotNull();

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("sig")).isNull();
        assertThat(cache.stats().expirations()).isEqualTo(1);
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void testInvalidateRemovesEveryEntryContainingEntity() {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 100, clock);
        cache.put("q1", List.of(new ScoredHit("B1", 0.9), new ScoredHit("B2", 0.5)));
        cache.put("q2", List.of(new ScoredHit("B2", 0.7)));
        cache.put("q3", List.of(new ScoredHit("B3", 0.4)));

        int removed = cache.invalidate("B2");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("q1")).isNull();
        assertThat(cache.get("q2")).isNull();
        assertThat(cache.get("q3")).isNotNull();
        assertThat(cache.invalidate("B2")).isZero();
    }

    @Test
    void testReplacingEntryUpdatesReverseIndex() {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 100, clock);
        cache.put("q1", List.of(new ScoredHit("B1", 0.9)));
        cache.put("q1", List.of(new ScoredHit("B9", 0.3)));

        assertThat(cache.invalidate("B1")).isZero();
        assertThat(cache.get("q1")).isNotNull();
        assertThat(cache.invalidate("B9")).isEqualTo(1);
    }

    @Test
    void testConcurrentPutAndInvalidateNeverLeavesUnindexedEntry() throws Exception {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 1000, clock);
        int writers = 4;
        int signaturesPerWriter = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String prefix = "w" + w + "-";
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 5000; i++) {
                    cache.put(prefix + (i % signaturesPerWriter),
                            List.of(new ScoredHit("E", 0.9), new ScoredHit("F" + (i % 3), 0.4)));
                }
                return null;
            }));
        }
        for (int r = 0; r < 2; r++) {
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 5000; i++) {
                    cache.invalidate("E");
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> task : tasks) {
            task.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        cache.invalidate("E");

        for (int w = 0; w < writers; w++) {
            for (int i = 0; i < signaturesPerWriter; i++) {
                assertThat(cache.get("w" + w + "-" + i)).isNull();
            }
        }
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    void testEvictsLeastRecentlyUsedBeyondCapacity() {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 2, clock);
        cache.put("a", List.of(new ScoredHit("A", 1.0)));
        cache.put("b", List.of(new ScoredHit("B", 1.0)));
        assertThat(cache.get("a")).isNotNull();

        cache.put("c", List.of(new ScoredHit("C", 1.0)));

        assertThat(cache.get("b")).isNull();
        assertThat(cache.get("a")).isNotNull();
        assertThat(cache.get("c")).isNotNull();
        assertThat(cache.stats().evictions()).isEqualTo(1);
        assertThat(cache.invalidate("B")).isZero();
    }

    @Test
    void testPutEntryKeepsCreationTime() {
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 100, clock);
        CacheEntry entry = new CacheEntry("other", List.of(new ScoredHit("B1", 1.0)),
                clock.instant().minus(Duration.ofMinutes(4)), Duration.ofMinutes(5));

        cache.put("sig", entry);

        assertThat(cache.get("sig").querySignature()).isEqualTo("sig");
        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("sig")).isNull();
    }

    @Test
    void testStatsAndMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ResultCache cache = new ResultCache(true, Duration.ofSeconds(300), 100, clock, registry);
        cache.put("sig", List.of(new ScoredHit("B1", 1.0)));
        cache.get("sig");
        cache.get("sig");
        cache.get("missing");

        CacheStats stats = cache.stats();

        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.ttlSeconds()).isEqualTo(300);
        assertThat(registry.counter("result_cache_hit_total").count()).isEqualTo(2.0);
        assertThat(registry.counter("result_cache_miss_total").count()).isEqualTo(1.0);
        assertThat(cache.clear()).isEqualTo(1);
        assertThat(cache.get("sig")).isNull();
    }

    @Test
    void testDisabledCacheAlwaysMisses() {
        ResultCache cache = new ResultCache(false, Duration.ofSeconds(300), 100, clock, null);
        cache.put("sig", List.of(new ScoredHit("B1", 1.0)));

        assertThat(cache.get("sig")).isNull();
    }

    @Test
    void testSignatureNormalizesTextAndFilterOrder() {
        SearchFilters first = new SearchFilters("bill", "passed", null, null);
        SearchFilters second = new SearchFilters();
        second.setStatus("passed");
        second.setCategory("bill");

        String a = ResultCache.signature("  Consumption   TAX ", first, 20);
        String b = ResultCache.signature("consumption tax", second, 20);

        assertThat(a).isEqualTo(b).hasSize(64);
        assertThat(ResultCache.signature("consumption tax", second, 40)).isNotEqualTo(a);
        assertThat(ResultCache.signature("consumption tax", SearchFilters.none(), 20)).isNotEqualTo(a);
    }
}
