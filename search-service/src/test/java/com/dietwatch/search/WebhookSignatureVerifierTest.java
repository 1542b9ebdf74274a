package com.dietwatch.search;

import com.dietwatch.search.sync.WebhookSignatureVerifier;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"entity_id\":\"rec1\",\"version\":3}".getBytes(StandardCharsets.UTF_8);

    @Test
    void testAcceptsMatchingSignature() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("s3cret");

        String signature = verifier.signatureFor(BODY);

        assertThat(signature).startsWith("sha256=").hasSize("sha256=".length() + 64);
        assertThat(verifier.verify(BODY, signature)).isTrue();
        assertThat(verifier.verify(BODY, signature.toUpperCase().replace("SHA256=", "sha256="))).isTrue();
    }

    @Test
    void testRejectsTamperedOrMissingSignature() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("s3cret");
        String signature = verifier.signatureFor(BODY);
        byte[] tampered = "{\"entity_id\":\"rec1\",\"version\":4}".getBytes(StandardCharsets.UTF_8);

        assertThat(verifier.verify(tampered, signature)).isFalse();
        assertThat(verifier.verify(BODY, null)).isFalse();
        assertThat(verifier.verify(BODY, "sha256=not-hex")).isFalse();
        assertThat(verifier.verify(BODY, new WebhookSignatureVerifier("other").signatureFor(BODY))).isFalse();
    }

    @Test
    void testWithoutSecretEverythingPasses() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("");

        assertThat(verifier.isEnabled()).isFalse();
        assertThat(verifier.verify(BODY, null)).isTrue();
    }
}
