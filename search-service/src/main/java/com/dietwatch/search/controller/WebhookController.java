package com.dietwatch.search.controller;

import com.dietwatch.search.model.EnqueueOutcome;
import com.dietwatch.search.model.WriteNotification;
import com.dietwatch.search.sync.WebhookSignatureVerifier;
import com.dietwatch.search.sync.WriteNotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Receives structured-store write notifications, one {@code {entity_id, version}} object or an array
 * of them.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WriteNotificationService writeNotificationService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final int maxPayloadBytes;

    public WebhookController(
            WriteNotificationService writeNotificationService,
            WebhookSignatureVerifier signatureVerifier,
            ObjectMapper objectMapper
    ) {
        this(writeNotificationService, signatureVerifier, objectMapper, 1024 * 1024);
    }

    @Autowired
    public WebhookController(
            WriteNotificationService writeNotificationService,
            WebhookSignatureVerifier signatureVerifier,
            ObjectMapper objectMapper,
            @Value("${webhook.max-payload-bytes:1048576}") int maxPayloadBytes
    ) {
        this.writeNotificationService = writeNotificationService;
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
        this.maxPayloadBytes = maxPayloadBytes;
    }

    @PostMapping("/structured-store")
    public ResponseEntity<?> structuredStoreWrite(
            @RequestBody byte[] body,
            @RequestHeader(value = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature
    ) throws JsonProcessingException {
        if (body.length > maxPayloadBytes) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(ProblemDetail.forStatusAndDetail(HttpStatus.PAYLOAD_TOO_LARGE, "payload exceeds " + maxPayloadBytes + " bytes"));
        }
        if (!signatureVerifier.verify(body, signature)) {
            log.warn("event=webhook_rejected reason=bad_signature bytes={}", body.length);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, "invalid webhook signature"));
        }

        List<WriteNotification> notifications;
        try {
            notifications = WriteNotificationService.parse(objectMapper, new String(body, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest()
                    .body(ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage()));
        }

        List<EnqueueOutcome> outcomes = writeNotificationService.onWrites(notifications);
        Map<EnqueueOutcome, Integer> summary = new EnumMap<>(EnqueueOutcome.class);
        for (EnqueueOutcome outcome : outcomes) {
            summary.merge(outcome, 1, Integer::sum);
        }
        log.info("event=webhook_accepted notifications={} outcomes={}", notifications.size(), summary);
        return ResponseEntity.accepted().body(Map.of("received", notifications.size(), "outcomes", summary));
    }
}
