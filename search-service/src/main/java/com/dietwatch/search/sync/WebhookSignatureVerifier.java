package com.dietwatch.search.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 check of the raw webhook body against {@code X-Airtable-Webhook-Signature: sha256=<hex>}.
 * With no secret configured every request is accepted.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    public static final String SIGNATURE_HEADER = "X-Airtable-Webhook-Signature";
    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final byte[] secret;

    public WebhookSignatureVerifier(@Value("${webhook.secret:}") String secret) {
        this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (this.secret.length == 0) {
            log.warn("webhook.secret is not configured; webhook signatures will not be verified");
        }
    }

    public boolean isEnabled() {
        return secret.length > 0;
    }

    public boolean verify(byte[] body, String signatureHeader) {
        if (!isEnabled()) {
            return true;
        }
        if (signatureHeader == null || !signatureHeader.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return false;
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()).trim());
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return MessageDigest.isEqual(sign(body), provided);
    }

    public String signatureFor(byte[] body) {
        return PREFIX + HexFormat.of().formatHex(sign(body));
    }

    private byte[] sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body == null ? new byte[0] : body);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }
}
