package com.dietwatch.search.service;

import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.exception.RateLimitExceededException;
import com.dietwatch.search.exception.SearchUnavailableException;
import com.dietwatch.search.model.Backend;
import com.dietwatch.search.model.FullResults;
import com.dietwatch.search.model.MergedResult;
import com.dietwatch.search.model.PartialResults;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Public search entry point. Both backends run in parallel under one overall deadline; a branch that
 * times out is cancelled and the other branch's results are returned as {@link PartialResults}.
 */
@Service
public class QueryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
    private static final long MIN_DEADLINE_MS = 50L;
    private static final String OUTCOME_SUCCESS = "SUCCESS";
    private static final String OUTCOME_TIMEOUT = "TIMEOUT";
    private static final String OUTCOME_ERROR = "ERROR";

    private final StructuredStoreClient structuredStoreClient;
    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final MergeRanker mergeRanker;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;
    private final long deadlineMs;
    private final int maxCandidates;

    public QueryOrchestrator(
            StructuredStoreClient structuredStoreClient,
            VectorStoreClient vectorStoreClient,
            EmbeddingProvider embeddingProvider,
            MergeRanker mergeRanker,
            ExecutorService searchExecutor,
            long deadlineMs
    ) {
        this(structuredStoreClient, vectorStoreClient, embeddingProvider, mergeRanker, searchExecutor, null, deadlineMs, 200);
    }

    @Autowired
    public QueryOrchestrator(
            StructuredStoreClient structuredStoreClient,
            VectorStoreClient vectorStoreClient,
            EmbeddingProvider embeddingProvider,
            MergeRanker mergeRanker,
            @Qualifier("searchExecutor") ExecutorService searchExecutor,
            MeterRegistry meterRegistry,
            @Value("${search.deadline-ms:1500}") long deadlineMs,
            @Value("${search.max-candidates:200}") int maxCandidates
    ) {
        this.structuredStoreClient = structuredStoreClient;
        this.vectorStoreClient = vectorStoreClient;
        this.embeddingProvider = embeddingProvider;
        this.mergeRanker = mergeRanker;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
        this.deadlineMs = Math.max(MIN_DEADLINE_MS, deadlineMs);
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    public SearchOutcome search(String text, SearchFilters filters, Integer page, Integer pageSize) {
        return search(text, filters, page, pageSize, null);
    }

    public SearchOutcome search(String text, SearchFilters filters, Integer page, Integer pageSize, String traceId) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        long totalStart = System.nanoTime();
        int resolvedPage = resolvePage(page);
        int resolvedPageSize = resolvePageSize(pageSize);
        SearchFilters resolvedFilters = validate(text, filters);
        int fetchDepth = (int) Math.min(maxCandidates, (long) resolvedPage * resolvedPageSize);
        log.info(
                "trace_id={} event=search_start query=\"{}\" filters={} page={} page_size={} fetch_depth={}",
                effectiveTraceId,
                sanitizeForLog(text),
                resolvedFilters,
                resolvedPage,
                resolvedPageSize,
                fetchDepth
        );

        long deadline = totalStart + TimeUnit.MILLISECONDS.toNanos(deadlineMs);
        Future<List<ScoredHit>> keywordFuture = submit(() -> structuredStoreClient.query(text, resolvedFilters, fetchDepth));
        Future<List<ScoredHit>> vectorFuture = submit(() -> vectorStoreClient.nearest(
                embeddingProvider.embed(text),
                fetchDepth,
                resolvedFilters
        ));

        Branch keyword = await(Backend.KEYWORD, keywordFuture, totalStart, deadline, effectiveTraceId);
        if (keyword.error() instanceof InvalidQueryException invalid) {
            vectorFuture.cancel(true);
            throw invalid;
        }
        Branch vector = await(Backend.VECTOR, vectorFuture, totalStart, deadline, effectiveTraceId);
        if (keyword.failed() && vector.failed()) {
            incrementCounter("search_unavailable_total");
            log.error(
                    "trace_id={} event=search_unavailable keyword_outcome={} vector_outcome={} total_ms={}",
                    effectiveTraceId,
                    keyword.outcome(),
                    vector.outcome(),
                    elapsedMillis(totalStart)
            );
            if (keyword.error() instanceof RateLimitExceededException rateLimited) {
                throw rateLimited;
            }
            throw new SearchUnavailableException("both search backends failed", keyword.error());
        }

        long mergeStart = System.nanoTime();
        List<MergedResult> results = mergeRanker.merge(keyword.hits(), vector.hits(), resolvedPage, resolvedPageSize);
        recordTimer("search_merge_latency", mergeStart);

        SearchOutcome outcome;
        if (keyword.failed()) {
            outcome = degraded(Backend.KEYWORD, keyword, results);
        } else if (vector.failed()) {
            outcome = degraded(Backend.VECTOR, vector, results);
        } else {
            outcome = new FullResults(results);
        }
        recordTimer("search_total_latency", totalStart);
        log.info(
                "trace_id={} event=search_complete total_ms={} keyword_hits={} vector_hits={} returned={} degraded={}",
                effectiveTraceId,
                elapsedMillis(totalStart),
                keyword.hits().size(),
                vector.hits().size(),
                results.size(),
                outcome.degraded()
        );
        return outcome;
    }

    private PartialResults degraded(Backend backend, Branch branch, List<MergedResult> results) {
        if (meterRegistry != null) {
            meterRegistry.counter("search_degraded_total", "backend", backend.label()).increment();
        }
        return new PartialResults(results, backend, branch.reason());
    }

    private Future<List<ScoredHit>> submit(Callable<List<ScoredHit>> task) {
        try {
            return searchExecutor.submit(task);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private Branch await(Backend backend, Future<List<ScoredHit>> future, long totalStart, long deadline, String traceId) {
        long stageStart = System.nanoTime();
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            List<ScoredHit> hits = future.get(remaining, TimeUnit.NANOSECONDS);
            Branch branch = new Branch(hits == null ? List.of() : hits, OUTCOME_SUCCESS, null);
            logStage(traceId, backend, branch, totalStart);
            return branch;
        } catch (TimeoutException ex) {
            future.cancel(true);
            incrementCounter("search_stage_timeout_total");
            Branch branch = new Branch(List.of(), OUTCOME_TIMEOUT,
                    new TimeoutException(backend.label() + " branch exceeded " + deadlineMs + "ms deadline"));
            logStage(traceId, backend, branch, totalStart);
            return branch;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            incrementCounter("search_stage_error_total");
            Branch branch = new Branch(List.of(), OUTCOME_ERROR, cause);
            logStage(traceId, backend, branch, totalStart);
            return branch;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new Branch(List.of(), OUTCOME_ERROR, ex);
        } finally {
            recordTimer("search_stage_wait_" + backend.label(), stageStart);
        }
    }

    private static void logStage(String traceId, Backend backend, Branch branch, long totalStart) {
        if (branch.failed()) {
            log.warn(
                    "trace_id={} stage={}_search elapsed_ms={} outcome={} cause={}",
                    traceId,
                    backend.label(),
                    elapsedMillis(totalStart),
                    branch.outcome(),
                    branch.reason()
            );
        } else {
            log.info(
                    "trace_id={} stage={}_search elapsed_ms={} outcome={} hits={}",
                    traceId,
                    backend.label(),
                    elapsedMillis(totalStart),
                    branch.outcome(),
                    branch.hits().size()
            );
        }
    }

    public static SearchFilters validate(String text, SearchFilters filters) {
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("query must not be blank");
        }
        SearchFilters resolved = filters == null ? SearchFilters.none() : filters;
        Map<String, Object> unknown = resolved.getUnknown();
        if (!unknown.isEmpty()) {
            throw new InvalidQueryException("unknown filter keys: " + unknown.keySet());
        }
        LocalDate from = parseDate("date_from", resolved.getDateFrom());
        LocalDate to = parseDate("date_to", resolved.getDateTo());
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidQueryException("date_from must not be after date_to");
        }
        return resolved;
    }

    public static int resolvePage(Integer page) {
        if (page == null) {
            return DEFAULT_PAGE;
        }
        if (page < 1) {
            throw new InvalidQueryException("page must be >= 1");
        }
        return page;
    }

    public static int resolvePageSize(Integer pageSize) {
        if (pageSize == null) {
            return DEFAULT_PAGE_SIZE;
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidQueryException("page_size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return pageSize;
    }

    private static LocalDate parseDate(String key, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidQueryException(key + " must be an ISO date (yyyy-MM-dd): " + value, ex);
        }
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record Branch(List<ScoredHit> hits, String outcome, Throwable error) {

        boolean failed() {
            return error != null;
        }

        String reason() {
            return error == null ? null : outcome + ": " + error.getMessage();
        }
    }
}
