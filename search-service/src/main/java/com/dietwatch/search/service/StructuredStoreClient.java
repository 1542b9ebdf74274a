package com.dietwatch.search.service;

import com.dietwatch.search.exception.UpstreamThrottledException;
import com.dietwatch.search.model.CacheEntry;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.resilience.RateLimiter;
import com.dietwatch.search.resilience.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Every call to the structured store goes through here: cache first, then one rate-limiter permit per
 * attempt, with transient failures retried by the shared policy.
 *
 * <p>Keyword queries scan up to {@code maxScanRecords} matching records page by page, since the store
 * returns matches in view order rather than by relevance. The full ranked scan is cached once per query
 * and filter set, so every result page of a query is served from the same entry.
 */
@Service
public class StructuredStoreClient {
    private static final Logger log = LoggerFactory.getLogger(StructuredStoreClient.class);

    public static final int DEFAULT_MAX_SCAN_RECORDS = 300;

    private static final Comparator<ScoredHit> RANKING = Comparator
            .comparingDouble(ScoredHit::score).reversed()
            .thenComparing(ScoredHit::entityId);

    private final StructuredStoreGateway gateway;
    private final RateLimiter rateLimiter;
    private final ResultCache resultCache;
    private final MeterRegistry meterRegistry;
    private final Retry searchRetry;
    private final Retry readRetry;
    private final int maxScanRecords;

    public StructuredStoreClient(
            StructuredStoreGateway gateway,
            RateLimiter rateLimiter,
            ResultCache resultCache,
            RetryPolicy retryPolicy
    ) {
        this(gateway, rateLimiter, resultCache, retryPolicy, null, DEFAULT_MAX_SCAN_RECORDS);
    }

    @Autowired
    public StructuredStoreClient(
            StructuredStoreGateway gateway,
            RateLimiter rateLimiter,
            ResultCache resultCache,
            RetryPolicy retryPolicy,
            MeterRegistry meterRegistry,
            @Value("${structured-store.max-scan-records:300}") int maxScanRecords
    ) {
        this.gateway = gateway;
        this.rateLimiter = rateLimiter;
        this.resultCache = resultCache;
        this.meterRegistry = meterRegistry;
        this.searchRetry = retryPolicy.toRetry("structured-store-search");
        this.readRetry = retryPolicy.toRetry("structured-store-read");
        this.maxScanRecords = Math.max(1, maxScanRecords);
    }

    /**
     * Best {@code limit} keyword hits, ranked by score then entity id.
     */
    public List<ScoredHit> query(String text, SearchFilters filters, int limit) {
        String signature = ResultCache.signature(text, filters, maxScanRecords);
        CacheEntry cached = resultCache.get(signature);
        if (cached != null) {
            log.debug("event=structured_store_cache_hit signature={} hits={}", signature, cached.results().size());
            return top(cached.results(), limit);
        }
        long start = System.nanoTime();
        try {
            List<ScoredHit> ranked = scan(text, filters);
            resultCache.put(signature, ranked);
            return top(ranked, limit);
        } finally {
            recordTimer("structured_store_query_latency", start);
        }
    }

    public Optional<SearchableEntity> getEntity(String entityId) {
        return withPermit(readRetry, () -> gateway.getEntity(entityId));
    }

    /**
     * All records modified after {@code since}, following pagination. Each page costs one permit.
     */
    public List<SearchableEntity> listChangedSince(Instant since) {
        List<SearchableEntity> changed = new ArrayList<>();
        String offset = null;
        do {
            String pageOffset = offset;
            StructuredStoreGateway.ChangedPage page = withPermit(readRetry, () -> gateway.listChangedSince(since, pageOffset));
            changed.addAll(page.entities());
            offset = page.hasMore() ? page.nextOffset() : null;
        } while (offset != null);
        return changed;
    }

    private List<ScoredHit> scan(String text, SearchFilters filters) {
        List<ScoredHit> hits = new ArrayList<>();
        int scanned = 0;
        int pages = 0;
        String offset = null;
        do {
            String pageOffset = offset;
            StructuredStoreGateway.KeywordPage page = withPermit(searchRetry, () -> gateway.search(text, filters, pageOffset));
            hits.addAll(page.hits());
            scanned += page.scanned();
            pages++;
            offset = page.hasMore() ? page.nextOffset() : null;
        } while (offset != null && scanned < maxScanRecords);
        if (offset != null) {
            log.info("event=keyword_scan_truncated scanned={} pages={} max_scan_records={}", scanned, pages, maxScanRecords);
        }
        hits.sort(RANKING);
        return hits;
    }

    private static List<ScoredHit> top(List<ScoredHit> ranked, int limit) {
        return List.copyOf(ranked.size() <= limit ? ranked : ranked.subList(0, Math.max(0, limit)));
    }

    private <T> T withPermit(Retry retry, Supplier<T> call) {
        Supplier<T> attempt = () -> {
            rateLimiter.acquire();
            try {
                return call.get();
            } catch (UpstreamThrottledException ex) {
                rateLimiter.onThrottled(ex.getRetryAfter());
                throw ex;
            }
        };
        return Retry.decorateSupplier(retry, attempt).get();
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }
}
