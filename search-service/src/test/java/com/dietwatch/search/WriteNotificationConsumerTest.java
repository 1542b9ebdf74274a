package com.dietwatch.search;

import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.WriteNotification;
import com.dietwatch.search.sync.WriteNotificationConsumer;
import com.dietwatch.search.sync.WriteNotificationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WriteNotificationConsumerTest {

    private final List<WriteNotification> received = new ArrayList<>();

    private final WriteNotificationService service = new WriteNotificationService(null, null) {
        @Override
        public List<EnqueueOutcome> onWrites(List<WriteNotification> notifications) {
            received.addAll(notifications);
            return List.of();
        }
    };

    private final WriteNotificationConsumer consumer = new WriteNotificationConsumer(service, new ObjectMapper());

    @Test
    void testForwardsNotifications() {
        consumer.consume("[{\"entity_id\":\"rec1\",\"version\":2},{\"entity_id\":\"rec2\",\"version\":9}]");

        assertThat(received).containsExactly(new WriteNotification("rec1", 2), new WriteNotification("rec2", 9));
    }

    @Test
    void testDropsMalformedMessages() {
        consumer.consume("{not json");
        consumer.consume("");

        assertThat(received).isEmpty();
    }
}
