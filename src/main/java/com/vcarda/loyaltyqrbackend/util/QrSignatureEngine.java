package com.vcarda.loyaltyqrbackend.util;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Signs and verifies QR code payloads with HMAC-SHA256.
 *
 * Signature format: {@code <hex mac>.<issuedAt epoch seconds>}, where the MAC covers
 * {@code payload + "|" + issuedAt}. Because the timestamp is part of the MAC input it cannot be
 * moved to a different issuance time without invalidating the signature.
 *
 * Verification rejects:
 *  - malformed signatures,
 *  - timestamps further in the future than the allowed clock skew,
 *  - timestamps older than the signature validity window (180 days by default),
 *  - MAC mismatches (compared in constant time).
 *
 * The key is read once from configuration at startup. {@link HmacUtils} wraps a non thread-safe
 * {@code Mac}, so a fresh instance is created per call.
 */
@Component
@Slf4j
public class QrSignatureEngine {

    static final int MIN_SECRET_BYTES = 32;

    private final byte[] key;
    private final Duration validity;
    private final Duration clockSkew;
    private final Clock clock;

    @Autowired
    public QrSignatureEngine(QrCodeProperties properties, Clock clock) {
        this(properties.getSigningSecret(),
                Duration.ofDays(properties.getSignatureValidityDays()),
                properties.getSignatureClockSkew(),
                clock);
    }

    public QrSignatureEngine(String secret, Duration validity, Duration clockSkew, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "loyalty.qr.signing-secret must be configured with at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = secret.getBytes(StandardCharsets.UTF_8);
        this.validity = validity;
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        this.clock = clock;
    }

    /**
     * Sign a payload for the given issuance time (truncated to seconds).
     */
    public String sign(String payload, Instant issuedAt) {
        long epochSeconds = issuedAt.getEpochSecond();
        return mac(payload, epochSeconds) + "." + epochSeconds;
    }

    /**
     * @return true only if the signature was produced by this key over exactly this payload
     *         and its embedded timestamp lies inside the validity window
     */
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        int dot = signature.lastIndexOf('.');
        if (dot <= 0 || dot == signature.length() - 1) {
            return false;
        }

        long epochSeconds;
        Instant issuedAt;
        try {
            epochSeconds = Long.parseLong(signature.substring(dot + 1));
            issuedAt = Instant.ofEpochSecond(epochSeconds);
        } catch (NumberFormatException | DateTimeException e) {
            return false;
        }

        Instant now = clock.instant();
        if (issuedAt.isAfter(now.plus(clockSkew))) {
            log.warn("[QR-SIGN] Signature timestamp is in the future. issuedAt={}", issuedAt);
            return false;
        }
        if (issuedAt.isBefore(now.minus(validity))) {
            log.info("[QR-SIGN] Signature outside validity window. issuedAt={}", issuedAt);
            return false;
        }

        byte[] expected = mac(payload, epochSeconds).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.substring(0, dot).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private String mac(String payload, long epochSeconds) {
        String material = payload + "|" + epochSeconds;
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmacHex(material);
    }
}
