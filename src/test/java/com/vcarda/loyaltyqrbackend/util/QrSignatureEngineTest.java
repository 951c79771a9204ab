package com.vcarda.loyaltyqrbackend.util;

import com.vcarda.loyaltyqrbackend.support.MutableClock;
import com.vcarda.loyaltyqrbackend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for QrSignatureEngine.
 */
class QrSignatureEngineTest {

    private static final String PAYLOAD = "{\"customerId\":42,\"qrUniqueId\":\"u-1\",\"type\":\"customer\"}";

    private MutableClock clock;
    private QrSignatureEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        engine = TestFixtures.signer(clock);
    }

    // ============ Happy Path ============

    @Test
    void sign_thenVerify_accepts() {
        String sig = engine.sign(PAYLOAD, clock.instant());

        assertThat(sig).matches("[0-9a-f]{64}\\.\\d+");
        assertThat(sig).endsWith("." + clock.instant().getEpochSecond());
        assertThat(engine.verify(PAYLOAD, sig)).isTrue();
    }

    @Test
    void verify_acceptsSignatureWithinSkew() {
        String sig = engine.sign(PAYLOAD, clock.instant().plus(Duration.ofMinutes(4)));
        assertThat(engine.verify(PAYLOAD, sig)).isTrue();
    }

    // ============ Tampering ============

    @Test
    void verify_rejectsChangedPayload() {
        String sig = engine.sign(PAYLOAD, clock.instant());
        assertThat(engine.verify(PAYLOAD.replace("42", "43"), sig)).isFalse();
    }

    @Test
    void verify_rejectsFlippedMacDigit() {
        String sig = engine.sign(PAYLOAD, clock.instant());
        assertThat(engine.verify(PAYLOAD, TestFixtures.flipSignatureBit(sig))).isFalse();
    }

    @Test
    void verify_rejectsSwappedTimestamp() {
        String sig = engine.sign(PAYLOAD, clock.instant());
        String mac = sig.substring(0, sig.indexOf('.'));
        long otherTs = clock.instant().minusSeconds(60).getEpochSecond();

        assertThat(engine.verify(PAYLOAD, mac + "." + otherTs)).isFalse();
    }

    @Test
    void verify_rejectsOtherKey() {
        QrSignatureEngine other = new QrSignatureEngine(
                "another-secret-that-is-long-enough-000000", Duration.ofDays(180), Duration.ofMinutes(5), clock);
        String sig = other.sign(PAYLOAD, clock.instant());
        assertThat(engine.verify(PAYLOAD, sig)).isFalse();
    }

    // ============ Time window ============

    @Test
    void verify_rejectsFutureTimestampBeyondSkew() {
        String sig = engine.sign(PAYLOAD, clock.instant().plus(Duration.ofMinutes(10)));
        assertThat(engine.verify(PAYLOAD, sig)).isFalse();
    }

    @Test
    void verify_rejectsSignatureOlderThanValidityWindow() {
        String sig = engine.sign(PAYLOAD, clock.instant());
        clock.advance(Duration.ofDays(181));
        assertThat(engine.verify(PAYLOAD, sig)).isFalse();
    }

    // ============ Malformed input ============

    @Test
    void verify_rejectsMalformedSignatures() {
        assertThat(engine.verify(PAYLOAD, null)).isFalse();
        assertThat(engine.verify(null, "abc.1")).isFalse();
        assertThat(engine.verify(PAYLOAD, "")).isFalse();
        assertThat(engine.verify(PAYLOAD, "no-dot-here")).isFalse();
        assertThat(engine.verify(PAYLOAD, ".12345")).isFalse();
        assertThat(engine.verify(PAYLOAD, "abcdef.")).isFalse();
        assertThat(engine.verify(PAYLOAD, "abcdef.not-a-number")).isFalse();
        assertThat(engine.verify(PAYLOAD, "abcdef.99999999999999999999")).isFalse();
    }

    // ============ Key configuration ============

    @Test
    void constructor_rejectsMissingOrShortSecret() {
        assertThatThrownBy(() -> new QrSignatureEngine(null, Duration.ofDays(1), Duration.ZERO, clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new QrSignatureEngine("too-short", Duration.ofDays(1), Duration.ZERO, clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("signing-secret");
    }
}
