package com.dietwatch.search.sync;

import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.SyncJob;
import com.dietwatch.search.model.SyncQueueStats;

import java.util.List;
import java.util.Optional;

/**
 * Durable queue of vector re-sync jobs.
 *
 * <p>State machine: PENDING -> IN_PROGRESS -> COMPLETED, or FAILED (claimable again once its backoff
 * elapses) and finally DEAD_LETTERED after the maximum number of attempts. Dead-lettered jobs only
 * move again through {@link #requeue(long)}.
 */
public interface SyncQueue {

    /**
     * Queues {@code (entityId, version)}. A PENDING or FAILED job for the same entity is bumped in
     * place to the newer version with its attempts reset; an equal or older version is a no-op.
     */
    EnqueueOutcome enqueue(String entityId, long version);

    /**
     * Atomically moves one claimable job to IN_PROGRESS. Each job is handed to exactly one caller.
     */
    Optional<SyncJob> claim();

    void complete(long jobId);

    /**
     * Records a failed attempt; the job is retried after a backoff or dead-lettered once attempts run out.
     *
     * @return the job after the transition, empty if it was not IN_PROGRESS
     */
    Optional<SyncJob> fail(long jobId, String error);

    Optional<SyncJob> find(long jobId);

    List<SyncJob> deadLetters(int limit);

    /**
     * Sends a dead-lettered job back to PENDING with its attempts reset.
     */
    boolean requeue(long jobId);

    /**
     * Returns IN_PROGRESS jobs whose lease expired to PENDING.
     */
    int recoverStale();

    /**
     * Deletes COMPLETED jobs older than the retention window.
     */
    int purgeCompleted();

    SyncQueueStats stats();
}
