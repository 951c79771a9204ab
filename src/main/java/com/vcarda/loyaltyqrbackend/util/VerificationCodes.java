package com.vcarda.loyaltyqrbackend.util;

import java.security.SecureRandom;

/**
 * Short codes for manual entry when a printed code cannot be scanned.
 *
 * The alphabet leaves out glyphs that are easy to misread: 0/O and 1/I.
 */
public final class VerificationCodes {

    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int LENGTH = 6;

    private static final SecureRandom RND = new SecureRandom();

    private VerificationCodes() {
    }

    public static String generate() {
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(RND.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /** True if the value has the right length and only alphabet characters. */
    public static boolean isWellFormed(String value) {
        if (value == null || value.length() != LENGTH) return false;
        for (int i = 0; i < value.length(); i++) {
            if (ALPHABET.indexOf(value.charAt(i)) < 0) return false;
        }
        return true;
    }
}
