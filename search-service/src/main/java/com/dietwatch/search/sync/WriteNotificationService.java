package com.dietwatch.search.sync;

import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.WriteNotification;
import com.dietwatch.search.service.VectorStoreClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Common sink for write notifications from the webhook, Kafka and the poller.
 */
@Service
public class WriteNotificationService {
    private static final Logger log = LoggerFactory.getLogger(WriteNotificationService.class);

    private final SyncQueue syncQueue;
    private final VectorStoreClient vectorStoreClient;
    private final MeterRegistry meterRegistry;

    public WriteNotificationService(SyncQueue syncQueue, VectorStoreClient vectorStoreClient) {
        this(syncQueue, vectorStoreClient, null);
    }

    @Autowired
    public WriteNotificationService(SyncQueue syncQueue, VectorStoreClient vectorStoreClient, MeterRegistry meterRegistry) {
        this.syncQueue = syncQueue;
        this.vectorStoreClient = vectorStoreClient;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Enqueues a sync job only when the notified version is newer than the vector record's source
     * version (a missing record counts as version 0).
     */
    public EnqueueOutcome onWrite(WriteNotification notification) {
        validate(notification);
        long sourceVersion = vectorStoreClient.sourceVersion(notification.entityId());
        EnqueueOutcome outcome;
        if (notification.version() <= sourceVersion) {
            outcome = EnqueueOutcome.UP_TO_DATE;
        } else {
            outcome = syncQueue.enqueue(notification.entityId(), notification.version());
        }
        log.debug(
                "event=write_notification entity_id={} version={} source_version={} outcome={}",
                notification.entityId(),
                notification.version(),
                sourceVersion,
                outcome
        );
        if (meterRegistry != null) {
            meterRegistry.counter("write_notification_total", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        }
        return outcome;
    }

    public List<EnqueueOutcome> onWrites(List<WriteNotification> notifications) {
        notifications.forEach(WriteNotificationService::validate);
        List<EnqueueOutcome> outcomes = new ArrayList<>(notifications.size());
        for (WriteNotification notification : notifications) {
            outcomes.add(onWrite(notification));
        }
        return outcomes;
    }

    /**
     * Reads one notification object or an array of them.
     *
     * @throws IllegalArgumentException when the payload is empty
     */
    public static List<WriteNotification> parse(ObjectMapper objectMapper, String payload) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(payload == null ? "" : payload);
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("empty write notification");
        }
        List<WriteNotification> notifications = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                notifications.add(objectMapper.treeToValue(node, WriteNotification.class));
            }
        } else {
            notifications.add(objectMapper.treeToValue(root, WriteNotification.class));
        }
        return notifications;
    }

    private static void validate(WriteNotification notification) {
        if (notification == null || notification.entityId() == null || notification.entityId().isBlank()) {
            throw new InvalidQueryException("write notification requires entity_id");
        }
        if (notification.version() <= 0) {
            throw new InvalidQueryException("write notification version must be positive: " + notification.version());
        }
    }
}
