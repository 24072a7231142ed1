package com.ryuqq.analysis.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureThreshold OPEN으로 전이하는 연속 실패 수 (1 이상)
 * @param coolDown OPEN 유지 시간 (양수)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration coolDown
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, coolDown=60초</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(60));
    }

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (coolDown == null || coolDown.isZero() || coolDown.isNegative()) {
            throw new IllegalArgumentException(
                "coolDown must be positive (current: " + coolDown + ")"
            );
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, coolDown);
    }

    public CircuitBreakerConfig withCoolDown(Duration coolDown) {
        return new CircuitBreakerConfig(failureThreshold, coolDown);
    }
}
