package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.service.ratelimit.ScanRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: rate-limit counter sweep, expiry of overdue codes, batch rotation.
 *
 * Intervals are ISO-8601 durations ({@code loyalty.qr.maintenance.*}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "loyalty.qr.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CodeMaintenanceScheduler {

    private final ScanRateLimiter rateLimiter;
    private final CodeRegistry registry;
    private final RotationManager rotationManager;

    @Scheduled(fixedDelayString = "${loyalty.qr.maintenance.sweep-interval:PT5M}",
            initialDelayString = "${loyalty.qr.maintenance.sweep-interval:PT5M}")
    public void sweepRateLimitCounters() {
        int removed = rateLimiter.sweepExpired();
        if (removed > 0) {
            log.debug("[MAINTENANCE] Swept {} rate-limit counters", removed);
        }
    }

    @Scheduled(fixedDelayString = "${loyalty.qr.maintenance.expiry-interval:PT15M}",
            initialDelayString = "${loyalty.qr.maintenance.expiry-interval:PT15M}")
    public void expireOverdueCodes() {
        int expired = registry.expireOverdue();
        if (expired > 0) {
            log.info("[MAINTENANCE] Expired {} overdue codes", expired);
        }
    }

    @Scheduled(fixedDelayString = "${loyalty.qr.maintenance.rotation-interval:PT1H}",
            initialDelayString = "${loyalty.qr.maintenance.rotation-interval:PT1H}")
    public void rotateDueCodes() {
        rotationManager.rotateDue();
    }
}
