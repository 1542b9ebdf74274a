package com.dietwatch.search.service;

import com.dietwatch.search.model.CacheEntry;
import com.dietwatch.search.model.CacheStats;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of structured-store responses keyed by query signature, with LRU eviction above a fixed
 * entry count and a reverse index so a rewritten entity drops every cached result set containing it.
 *
 * <p>An entry and its reverse-index links change together inside one per-signature {@code compute},
 * so an entry is never visible without being indexed under every entity it contains.
 */
@Service
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final boolean enabled;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Slot> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> signaturesByEntity = new ConcurrentHashMap<>();
    private final AtomicLong accessTicks = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ResultCache(Duration ttl, int maxEntries, Clock clock) {
        this(true, ttl, maxEntries, clock, null);
    }

    @Autowired
    public ResultCache(
            @Value("${search.cache.enabled:true}") boolean enabled,
            @Value("${search.cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${search.cache.max-entries:5000}") int maxEntries,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this(enabled, Duration.ofSeconds(Math.max(1L, ttlSeconds)), maxEntries, clock, meterRegistry);
    }

    public ResultCache(boolean enabled, Duration ttl, int maxEntries, Clock clock, MeterRegistry meterRegistry) {
        this.enabled = enabled;
        this.ttl = ttl;
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return the live entry, or {@code null} on a miss (absent, expired or cache disabled)
     */
    public CacheEntry get(String signature) {
        if (!enabled) {
            return null;
        }
        Slot slot = entries.get(signature);
        if (slot == null) {
            recordMiss();
            return null;
        }
        if (slot.entry().isExpired(clock.instant())) {
            if (removeSlot(signature, slot)) {
                expirations.incrementAndGet();
                incrementCounter("result_cache_expired_total");
            }
            recordMiss();
            return null;
        }
        slot.touch(accessTicks.incrementAndGet());
        hits.incrementAndGet();
        incrementCounter("result_cache_hit_total");
        return slot.entry();
    }

    public void put(String signature, List<ScoredHit> results) {
        put(signature, new CacheEntry(signature, results, clock.instant(), ttl));
    }

    public void put(String signature, CacheEntry entry) {
        if (!enabled || entry == null) {
            return;
        }
        CacheEntry stored = signature.equals(entry.querySignature())
                ? entry
                : new CacheEntry(signature, entry.results(), entry.createdAt(), entry.ttl());
        Slot slot = new Slot(stored, accessTicks.incrementAndGet());
        entries.compute(signature, (key, previous) -> {
            index(key, stored);
            if (previous != null) {
                unindexExcept(previous.entry(), stored);
            }
            return slot;
        });
        evictIfNeeded();
    }

    /**
     * Drops every cached result set that contains {@code entityId}.
     *
     * @return number of entries removed
     */
    public int invalidate(String entityId) {
        Set<String> signatures = signaturesByEntity.get(entityId);
        if (signatures == null) {
            return 0;
        }
        AtomicInteger removed = new AtomicInteger();
        for (String signature : List.copyOf(signatures)) {
            entries.compute(signature, (key, slot) -> {
                if (slot == null || !containsEntity(slot.entry(), entityId)) {
                    removeSignature(entityId, key);
                    return slot;
                }
                unindex(slot.entry());
                removed.incrementAndGet();
                return null;
            });
        }
        return recordInvalidations(entityId, removed.get());
    }

    private int recordInvalidations(String entityId, int removed) {
        if (removed > 0) {
            invalidations.addAndGet(removed);
            if (meterRegistry != null) {
                meterRegistry.counter("result_cache_invalidated_total").increment(removed);
            }
            log.debug("event=cache_invalidate entity_id={} removed={}", entityId, removed);
        }
        return removed;
    }

    public int clear() {
        AtomicInteger removed = new AtomicInteger();
        for (String signature : List.copyOf(entries.keySet())) {
            entries.computeIfPresent(signature, (key, slot) -> {
                unindex(slot.entry());
                removed.incrementAndGet();
                return null;
            });
        }
        log.info("event=cache_clear removed={}", removed.get());
        return removed.get();
    }

    public CacheStats stats() {
        return new CacheStats(
                entries.size(),
                hits.get(),
                misses.get(),
                evictions.get(),
                invalidations.get(),
                expirations.get(),
                ttl.toSeconds(),
                maxEntries
        );
    }

    /**
     * SHA-256 over the normalized text (trimmed, lower-cased, whitespace collapsed), the filters in
     * key order and the limit.
     */
    public static String signature(String text, SearchFilters filters, int limit) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        StringBuilder key = new StringBuilder(normalized).append('\u0000');
        Map<String, String> sorted = filters == null ? Map.of() : filters.asSortedMap();
        sorted.forEach((name, value) -> key.append(name).append('=').append(value).append('\u0000'));
        key.append(limit);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            Map.Entry<String, Slot> eldest = null;
            for (Map.Entry<String, Slot> candidate : entries.entrySet()) {
                if (eldest == null || candidate.getValue().lastAccess() < eldest.getValue().lastAccess()) {
                    eldest = candidate;
                }
            }
            if (eldest == null) {
                return;
            }
            if (removeSlot(eldest.getKey(), eldest.getValue())) {
                evictions.incrementAndGet();
                incrementCounter("result_cache_evicted_total");
            }
        }
    }

    /**
     * Removes {@code expected} if it is still the entry stored under {@code signature}.
     */
    private boolean removeSlot(String signature, Slot expected) {
        AtomicBoolean removed = new AtomicBoolean();
        entries.computeIfPresent(signature, (key, slot) -> {
            if (slot != expected) {
                return slot;
            }
            unindex(slot.entry());
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    private void index(String signature, CacheEntry entry) {
        for (ScoredHit hit : entry.results()) {
            signaturesByEntity.compute(hit.entityId(), (id, signatures) -> {
                Set<String> linked = signatures == null ? ConcurrentHashMap.newKeySet() : signatures;
                linked.add(signature);
                return linked;
            });
        }
    }

    private void unindex(CacheEntry entry) {
        for (ScoredHit hit : entry.results()) {
            removeSignature(hit.entityId(), entry.querySignature());
        }
    }

    private void unindexExcept(CacheEntry previous, CacheEntry current) {
        for (ScoredHit hit : previous.results()) {
            if (!containsEntity(current, hit.entityId())) {
                removeSignature(hit.entityId(), previous.querySignature());
            }
        }
    }

    private void removeSignature(String entityId, String signature) {
        signaturesByEntity.computeIfPresent(entityId, (id, signatures) -> {
            signatures.remove(signature);
            return signatures.isEmpty() ? null : signatures;
        });
    }

    private static boolean containsEntity(CacheEntry entry, String entityId) {
        for (ScoredHit hit : entry.results()) {
            if (hit.entityId().equals(entityId)) {
                return true;
            }
        }
        return false;
    }

    private void recordMiss() {
        misses.incrementAndGet();
        incrementCounter("result_cache_miss_total");
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static final class Slot {
        private final CacheEntry entry;
        private volatile long lastAccess;

        private Slot(CacheEntry entry, long lastAccess) {
            this.entry = entry;
            this.lastAccess = lastAccess;
        }

        CacheEntry entry() {
            return entry;
        }

        long lastAccess() {
            return lastAccess;
        }

        void touch(long tick) {
            lastAccess = tick;
        }
    }
}
