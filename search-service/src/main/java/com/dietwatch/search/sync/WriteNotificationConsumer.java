package com.dietwatch.search.sync;

import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.model.WriteNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Write notifications published on Kafka by the ingestion side. Malformed messages are logged and
 * dropped; store failures propagate so the container's error handler can redeliver.
 */
@Component
public class WriteNotificationConsumer {
    private static final Logger log = LoggerFactory.getLogger(WriteNotificationConsumer.class);

    private final WriteNotificationService writeNotificationService;
    private final ObjectMapper objectMapper;

    public WriteNotificationConsumer(WriteNotificationService writeNotificationService, ObjectMapper objectMapper) {
        this.writeNotificationService = writeNotificationService;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(
            topics = "${sync.kafka.topic:structured-store-writes}",
            groupId = "${spring.kafka.consumer.group-id:search-sync}",
            autoStartup = "${sync.kafka.enabled:false}"
    )
    public void consume(String message) {
        List<WriteNotification> notifications;
        try {
            notifications = WriteNotificationService.parse(objectMapper, message);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("event=write_notification_dropped reason=malformed cause={}", ex.getMessage());
            return;
        }
        try {
            writeNotificationService.onWrites(notifications);
        } catch (InvalidQueryException ex) {
            log.warn("event=write_notification_dropped reason=invalid cause={}", ex.getMessage());
        }
    }
}
