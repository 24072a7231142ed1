package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.protection.CircuitBreakerConfig;
import com.ryuqq.analysis.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Resilience4jCircuitBreakerAdapter 테스트.
 *
 * <ul>
 *   <li>연속 N회 실패에서만 OPEN</li>
 *   <li>cool-down 동안 거부, 경과 후 시험 호출 하나만 허용</li>
 *   <li>시험 호출 결과로 CLOSED 또는 OPEN</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class Resilience4jCircuitBreakerAdapterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private SettableClock clock;
    private Resilience4jCircuitBreakerAdapter breaker;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(T0);
        breaker = new Resilience4jCircuitBreakerAdapter("anthropic/claude",
            new CircuitBreakerConfig(3, Duration.ofSeconds(60)), clock);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThat(breaker.tryAcquire()).isTrue();
            breaker.recordFailure(new RuntimeException("503 upstream"));
        }
    }

    // ============================================================
    // 1. CLOSED
    // ============================================================

    @Test
    void tryAcquire_처음에는_허용() {
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getNotPermittedCalls()).isZero();
        assertThat(breaker.getName()).isEqualTo("anthropic/claude");
    }

    @Test
    void recordFailure_임계값_미만이면_CLOSED_유지() {
        // when
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getBufferedCalls()).isEqualTo(2);
        assertThat(breaker.getFailureRate()).isEqualTo(-1.0f);
    }

    @Test
    void recordSuccess_사이에_성공이_있으면_연속_실패가_끊김() {
        // given
        failTimes(2);

        // when
        breaker.recordSuccess();
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getFailureRate()).isLessThan(100.0f);
    }

    // ============================================================
    // 2. OPEN
    // ============================================================

    @Test
    void recordFailure_연속_N회면_OPEN_후_cool_down_동안_거부() {
        // when
        failTimes(3);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.set(T0.plusSeconds(59));
        assertThat(breaker.tryAcquire()).isFalse();
        clock.set(T0.plusSeconds(60));
        assertThat(breaker.tryAcquire()).isFalse();
        assertThat(breaker.getNotPermittedCalls()).isEqualTo(2);
    }

    @Test
    void recordFailure_원인이_없어도_실패로_기록() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(null);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    // ============================================================
    // 3. HALF_OPEN
    // ============================================================

    @Test
    void tryAcquire_cool_down_후에는_시험_호출_하나만_허용() {
        // given
        failTimes(3);
        clock.set(T0.plusSeconds(61));

        // when
        boolean trial = breaker.tryAcquire();
        boolean concurrent = breaker.tryAcquire();

        // then
        assertThat(trial).isTrue();
        assertThat(concurrent).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void recordSuccess_시험_호출이_성공하면_CLOSED() {
        // given
        failTimes(3);
        clock.set(T0.plusSeconds(61));
        assertThat(breaker.tryAcquire()).isTrue();

        // when
        breaker.recordSuccess();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
        failTimes(2);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void recordFailure_시험_호출이_실패하면_새_cool_down으로_다시_OPEN() {
        // given
        failTimes(3);
        Instant trialAt = T0.plusSeconds(61);
        clock.set(trialAt);
        assertThat(breaker.tryAcquire()).isTrue();

        // when
        breaker.recordFailure(new RuntimeException("still down"));

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.set(trialAt.plusSeconds(59));
        assertThat(breaker.tryAcquire()).isFalse();
        clock.set(trialAt.plusSeconds(61));
        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    void reset_CLOSED로_복귀() {
        failTimes(3);

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getBufferedCalls()).isZero();
    }

    @Test
    void constructor_잘못된_파라미터는_거부() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThatThrownBy(() -> new Resilience4jCircuitBreakerAdapter(" ", config, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Resilience4jCircuitBreakerAdapter("m", null, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Resilience4jCircuitBreakerAdapter("m", config, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class SettableClock extends Clock {

        private volatile Instant now;

        SettableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
