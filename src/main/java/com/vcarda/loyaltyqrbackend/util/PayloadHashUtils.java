package com.vcarda.loyaltyqrbackend.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * SHA-256 fingerprint of raw scanned text.
 *
 * Scan audit rows store this instead of the text itself, so repeated submissions of the same
 * image can be correlated without keeping customer data from the code in the scan log.
 */
public final class PayloadHashUtils {

    private PayloadHashUtils() {
    }

    /**
     * @return lower-case hex SHA-256, or null for null input
     */
    public static String sha256Hex(String raw) {
        if (raw == null) {
            return null;
        }
        return DigestUtils.sha256Hex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
