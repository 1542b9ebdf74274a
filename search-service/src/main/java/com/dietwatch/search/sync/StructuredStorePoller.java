package com.dietwatch.search.sync;

import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.model.WriteNotification;
import com.dietwatch.search.service.StructuredStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fallback change detection for deployments without webhooks: periodically lists records modified
 * since the previous successful poll and feeds them through {@link WriteNotificationService}.
 */
@Component
public class StructuredStorePoller {
    private static final Logger log = LoggerFactory.getLogger(StructuredStorePoller.class);

    private final StructuredStoreClient structuredStoreClient;
    private final WriteNotificationService writeNotificationService;
    private final Clock clock;
    private final boolean enabled;
    private final Duration overlap;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastPoll;

    public StructuredStorePoller(
            StructuredStoreClient structuredStoreClient,
            WriteNotificationService writeNotificationService,
            Clock clock,
            @Value("${sync.polling.enabled:false}") boolean enabled,
            @Value("${sync.polling.initial-lookback-seconds:3600}") long initialLookbackSeconds,
            @Value("${sync.polling.overlap-seconds:5}") long overlapSeconds
    ) {
        this.structuredStoreClient = structuredStoreClient;
        this.writeNotificationService = writeNotificationService;
        this.clock = clock;
        this.enabled = enabled;
        this.overlap = Duration.ofSeconds(Math.max(0L, overlapSeconds));
        this.lastPoll = clock.instant().minusSeconds(Math.max(0L, initialLookbackSeconds));
    }

    @Scheduled(
            initialDelayString = "${sync.polling.initial-delay-ms:10000}",
            fixedDelayString = "${sync.polling.interval-ms:30000}"
    )
    public void tick() {
        if (!enabled) {
            return;
        }
        poll();
    }

    /**
     * @return number of sync jobs enqueued or bumped, or -1 when another poll is still running
     */
    public int poll() {
        if (!running.compareAndSet(false, true)) {
            return -1;
        }
        try {
            Instant pollStart = clock.instant();
            // overlap guards against clock skew between this host and the store
            Instant since = lastPoll.minus(overlap);
            List<SearchableEntity> changed;
            try {
                changed = structuredStoreClient.listChangedSince(since);
            } catch (RuntimeException ex) {
                log.warn("event=poll_failed since={} cause={}", since, ex.toString());
                return 0;
            }
            int queued = 0;
            for (SearchableEntity entity : changed) {
                EnqueueOutcome outcome = writeNotificationService.onWrite(new WriteNotification(entity.id(), entity.version()));
                if (outcome == EnqueueOutcome.ENQUEUED || outcome == EnqueueOutcome.BUMPED) {
                    queued++;
                }
            }
            lastPoll = pollStart;
            log.info("event=poll_complete since={} changed={} queued={}", since, changed.size(), queued);
            return queued;
        } finally {
            running.set(false);
        }
    }

    public Instant getLastPoll() {
        return lastPoll;
    }
}
