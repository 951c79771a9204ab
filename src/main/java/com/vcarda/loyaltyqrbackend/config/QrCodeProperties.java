package com.vcarda.loyaltyqrbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Process-wide QR code settings, bound once at startup from {@code loyalty.qr.*}.
 *
 * Notes:
 *  - {@code rotationIntervalDays = 0} disables rotation (codes never need a refresh).
 *  - The signing secret must be supplied per environment; the engine refuses to start without it.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "loyalty.qr")
public class QrCodeProperties {

    /** HMAC key for code signatures (at least 32 bytes). */
    private String signingSecret;

    /** Age after which a code must be rotated before it is accepted again. 0 = disabled. */
    private int rotationIntervalDays = 0;

    /** Signatures older than this are rejected even when the MAC matches. */
    private int signatureValidityDays = 180;

    /** Accepted clock skew for signatures stamped slightly in the future. */
    private Duration signatureClockSkew = Duration.ofMinutes(5);

    private final RateLimit rateLimit = new RateLimit();

    private final Store store = new Store();

    private final Capacity capacity = new Capacity();

    private final Maintenance maintenance = new Maintenance();

    @Getter
    @Setter
    public static class RateLimit {

        /** Fixed window over which scan attempts are counted. */
        private Duration window = Duration.ofMinutes(1);

        /** Attempts allowed per (scanner, source address) per window. */
        private int threshold = 30;

        /** "memory" for a single instance, "redis" for a shared counter store. */
        private String store = "memory";

        /** Key prefix used by the shared counter store. */
        private String keyPrefix = "qr-scan-rl";
    }

    @Getter
    @Setter
    public static class Store {

        /** Total attempts (first try included) for units of work failing with a transient error. */
        private int maxAttempts = 3;

        /** Fixed delay between attempts. */
        private Duration backoff = Duration.ofMillis(200);

        /** When set, the delay is drawn uniformly from [backoff, backoff + jitter]. */
        private Duration jitter = Duration.ZERO;

        /** Timeout applied to every explicit transaction. */
        private Duration transactionTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Capacity {

        /** Scan requests accepted per minute by this instance before answering 429. */
        private long scansPerMinute = 600;
    }

    @Getter
    @Setter
    public static class Maintenance {

        /** Turns off the scheduled sweeps (tests, or instances that should not run batch work). */
        private boolean enabled = true;

        private Duration sweepInterval = Duration.ofMinutes(5);

        private Duration expiryInterval = Duration.ofMinutes(15);

        private Duration rotationInterval = Duration.ofHours(1);

        /** Upper bound of codes rotated per maintenance run. */
        private int rotationBatchSize = 100;
    }
}
