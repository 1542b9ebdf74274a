package com.dietwatch.search.sync;

import com.dietwatch.search.exception.SyncPermanentFailureException;
import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.SyncJob;
import com.dietwatch.search.model.SyncJobStatus;
import com.dietwatch.search.model.SyncQueueStats;
import com.dietwatch.search.resilience.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SyncQueue} on the {@code sync_jobs} table. Timestamps are epoch milliseconds.
 */
@Repository
public class JdbcSyncQueue implements SyncQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcSyncQueue.class);

    private static final int LOCK_STRIPES = 64;
    private static final int CLAIM_CANDIDATES = 8;
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_HISTORY_LENGTH = 8000;
    private static final String HISTORY_SEPARATOR = "\n";
    private static final String CLAIMABLE = "('PENDING', 'FAILED')";

    private static final String SELECT_COLUMNS = """
            SELECT id, entity_id, requested_version, attempt_count, status, last_error, error_history,
                   next_attempt_at, claimed_at, created_at, updated_at
            FROM sync_jobs
            """;

    private final JdbcTemplate jdbcTemplate;
    private final RetryPolicy backoffPolicy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final Duration lease;
    private final Duration retention;
    private final Object[] enqueueLocks = new Object[LOCK_STRIPES];

    public JdbcSyncQueue(JdbcTemplate jdbcTemplate, RetryPolicy backoffPolicy, Clock clock, int maxAttempts) {
        this(jdbcTemplate, backoffPolicy, clock, null, maxAttempts, 300L, 7L * 24 * 3600);
    }

    @Autowired
    public JdbcSyncQueue(
            JdbcTemplate jdbcTemplate,
            @Qualifier("syncBackoffPolicy") RetryPolicy backoffPolicy,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${sync.max-attempts:5}") int maxAttempts,
            @Value("${sync.lease-seconds:300}") long leaseSeconds,
            @Value("${sync.completed-retention-seconds:604800}") long retentionSeconds
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.lease = Duration.ofSeconds(Math.max(1L, leaseSeconds));
        this.retention = Duration.ofSeconds(Math.max(1L, retentionSeconds));
        for (int i = 0; i < LOCK_STRIPES; i++) {
            enqueueLocks[i] = new Object();
        }
        if (meterRegistry != null) {
            meterRegistry.gauge("sync_queue_depth", this, queue -> queue.stats().depth());
        }
    }

    @Override
    public EnqueueOutcome enqueue(String entityId, long version) {
        synchronized (lockFor(entityId)) {
            long now = clock.millis();
            List<SyncJob> queued = jdbcTemplate.query(
                    SELECT_COLUMNS + " WHERE entity_id = ? AND status IN " + CLAIMABLE + " ORDER BY id",
                    ROW_MAPPER,
                    entityId
            );
            if (!queued.isEmpty()) {
                SyncJob existing = queued.get(0);
                if (version <= existing.requestedVersion()) {
                    return EnqueueOutcome.ALREADY_QUEUED;
                }
                int bumped = jdbcTemplate.update(
                        """
                        UPDATE sync_jobs
                        SET requested_version = ?, attempt_count = 0, status = 'PENDING', last_error = NULL,
                            error_history = NULL, next_attempt_at = ?, updated_at = ?
                        WHERE id = ? AND status IN
                        """ + CLAIMABLE,
                        version,
                        now,
                        now,
                        existing.id()
                );
                if (bumped == 1) {
                    log.info(
                            "event=sync_job_bumped job_id={} entity_id={} from_version={} to_version={}",
                            existing.id(),
                            entityId,
                            existing.requestedVersion(),
                            version
                    );
                    incrementCounter("sync_job_bumped_total");
                    return EnqueueOutcome.BUMPED;
                }
                // claimed in the meantime; queue a fresh job behind it
            }
            jdbcTemplate.update(
                    """
                    INSERT INTO sync_jobs (entity_id, requested_version, attempt_count, status, next_attempt_at,
                                           created_at, updated_at)
                    VALUES (?, ?, 0, 'PENDING', ?, ?, ?)
                    """,
                    entityId,
                    version,
                    now,
                    now,
                    now
            );
            log.info("event=sync_job_enqueued entity_id={} version={}", entityId, version);
            incrementCounter("sync_job_enqueued_total");
            return EnqueueOutcome.ENQUEUED;
        }
    }

    @Override
    public Optional<SyncJob> claim() {
        long now = clock.millis();
        List<Long> candidates = jdbcTemplate.queryForList(
                "SELECT id FROM sync_jobs WHERE status IN " + CLAIMABLE
                        + " AND next_attempt_at <= ? ORDER BY next_attempt_at, id LIMIT ?",
                Long.class,
                now,
                CLAIM_CANDIDATES
        );
        for (Long id : candidates) {
            int claimed = jdbcTemplate.update(
                    "UPDATE sync_jobs SET status = 'IN_PROGRESS', claimed_at = ?, updated_at = ?"
                            + " WHERE id = ? AND status IN " + CLAIMABLE,
                    now,
                    now,
                    id
            );
            if (claimed == 1) {
                return find(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public void complete(long jobId) {
        long now = clock.millis();
        int updated = jdbcTemplate.update(
                "UPDATE sync_jobs SET status = 'COMPLETED', updated_at = ? WHERE id = ? AND status = 'IN_PROGRESS'",
                now,
                jobId
        );
        if (updated == 0) {
            log.warn("event=sync_job_complete_ignored job_id={} reason=not_in_progress", jobId);
        }
    }

    @Override
    public Optional<SyncJob> fail(long jobId, String error) {
        Optional<SyncJob> current = find(jobId);
        if (current.isEmpty() || current.get().status() != SyncJobStatus.IN_PROGRESS) {
            log.warn("event=sync_job_fail_ignored job_id={} reason=not_in_progress", jobId);
            return Optional.empty();
        }
        SyncJob job = current.get();
        long now = clock.millis();
        int attempts = job.attemptCount() + 1;
        String lastError = truncate(error == null ? "unknown error" : error, MAX_ERROR_LENGTH);
        List<String> history = new ArrayList<>(job.errorHistory());
        history.add("attempt " + attempts + " at " + Instant.ofEpochMilli(now) + ": " + lastError);
        String historyText = truncateHead(String.join(HISTORY_SEPARATOR, history), MAX_HISTORY_LENGTH);

        if (attempts >= maxAttempts) {
            jdbcTemplate.update(
                    """
                    UPDATE sync_jobs
                    SET status = 'DEAD_LETTERED', attempt_count = ?, last_error = ?, error_history = ?, updated_at = ?
                    WHERE id = ? AND status = 'IN_PROGRESS'
                    """,
                    attempts,
                    lastError,
                    historyText,
                    now,
                    jobId
            );
            incrementCounter("sync_job_dead_lettered_total");
            log.error(
                    "event=sync_job_dead_lettered job_id={} entity_id={} requested_version={} attempts={} last_error=\"{}\" history=\"{}\"",
                    jobId,
                    job.entityId(),
                    job.requestedVersion(),
                    attempts,
                    lastError,
                    historyText.replace(HISTORY_SEPARATOR, " | "),
                    new SyncPermanentFailureException(job.entityId(), attempts, lastError)
            );
        } else {
            long delayMs = backoffPolicy.delayForAttempt(attempts);
            jdbcTemplate.update(
                    """
                    UPDATE sync_jobs
                    SET status = 'FAILED', attempt_count = ?, last_error = ?, error_history = ?,
                        next_attempt_at = ?, claimed_at = NULL, updated_at = ?
                    WHERE id = ? AND status = 'IN_PROGRESS'
                    """,
                    attempts,
                    lastError,
                    historyText,
                    now + delayMs,
                    now,
                    jobId
            );
            incrementCounter("sync_job_failed_total");
            log.warn(
                    "event=sync_job_failed job_id={} entity_id={} attempt={} retry_in_ms={} error=\"{}\"",
                    jobId,
                    job.entityId(),
                    attempts,
                    delayMs,
                    lastError
            );
        }
        return find(jobId);
    }

    @Override
    public Optional<SyncJob> find(long jobId) {
        List<SyncJob> jobs = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", ROW_MAPPER, jobId);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public List<SyncJob> deadLetters(int limit) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + " WHERE status = 'DEAD_LETTERED' ORDER BY updated_at DESC, id DESC LIMIT ?",
                ROW_MAPPER,
                Math.max(1, limit)
        );
    }

    @Override
    public boolean requeue(long jobId) {
        long now = clock.millis();
        int updated = jdbcTemplate.update(
                """
                UPDATE sync_jobs
                SET status = 'PENDING', attempt_count = 0, next_attempt_at = ?, claimed_at = NULL, updated_at = ?
                WHERE id = ? AND status = 'DEAD_LETTERED'
                """,
                now,
                now,
                jobId
        );
        if (updated == 1) {
            log.info("event=sync_job_requeued job_id={}", jobId);
        }
        return updated == 1;
    }

    @Override
    public int recoverStale() {
        long now = clock.millis();
        int recovered = jdbcTemplate.update(
                """
                UPDATE sync_jobs
                SET status = 'PENDING', claimed_at = NULL, next_attempt_at = ?, updated_at = ?
                WHERE status = 'IN_PROGRESS' AND claimed_at < ?
                """,
                now,
                now,
                now - lease.toMillis()
        );
        if (recovered > 0) {
            log.warn("event=sync_job_lease_expired recovered={} lease_s={}", recovered, lease.toSeconds());
        }
        return recovered;
    }

    @Override
    public int purgeCompleted() {
        long cutoff = clock.millis() - retention.toMillis();
        int purged = jdbcTemplate.update(
                "DELETE FROM sync_jobs WHERE status = 'COMPLETED' AND updated_at < ?",
                cutoff
        );
        if (purged > 0) {
            log.info("event=sync_job_purged purged={}", purged);
        }
        return purged;
    }

    @Override
    public SyncQueueStats stats() {
        Map<SyncJobStatus, Long> counts = new EnumMap<>(SyncJobStatus.class);
        jdbcTemplate.query(
                "SELECT status, COUNT(*) AS total FROM sync_jobs GROUP BY status",
                (RowCallbackHandler) rs -> counts.put(SyncJobStatus.valueOf(rs.getString("status")), rs.getLong("total"))
        );
        return new SyncQueueStats(
                counts.getOrDefault(SyncJobStatus.PENDING, 0L),
                counts.getOrDefault(SyncJobStatus.IN_PROGRESS, 0L),
                counts.getOrDefault(SyncJobStatus.COMPLETED, 0L),
                counts.getOrDefault(SyncJobStatus.FAILED, 0L),
                counts.getOrDefault(SyncJobStatus.DEAD_LETTERED, 0L)
        );
    }

    private Object lockFor(String entityId) {
        return enqueueLocks[Math.floorMod(entityId.hashCode(), LOCK_STRIPES)];
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String truncateHead(String value, int max) {
        return value.length() <= max ? value : value.substring(value.length() - max);
    }

    private static final RowMapper<SyncJob> ROW_MAPPER = (rs, rowNum) -> {
        String history = rs.getString("error_history");
        long claimedAt = rs.getLong("claimed_at");
        boolean claimedAtMissing = rs.wasNull();
        return new SyncJob(
                rs.getLong("id"),
                rs.getString("entity_id"),
                rs.getLong("requested_version"),
                rs.getInt("attempt_count"),
                SyncJobStatus.valueOf(rs.getString("status")),
                rs.getString("last_error"),
                history == null || history.isEmpty() ? List.of() : Arrays.asList(history.split(HISTORY_SEPARATOR)),
                Instant.ofEpochMilli(rs.getLong("next_attempt_at")),
                claimedAtMissing ? null : Instant.ofEpochMilli(claimedAt),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at"))
        );
    };
}
