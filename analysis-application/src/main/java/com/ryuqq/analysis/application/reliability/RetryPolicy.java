package com.ryuqq.analysis.application.reliability;

import java.time.Duration;

/**
 * Provider 호출 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 모델 하나당 총 시도 횟수 (기본 3)</li>
 *   <li>baseDelay: 지수 백오프 기본 대기 (기본 1초)</li>
 *   <li>maxDelay: 지수 백오프 상한 (기본 60초)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.2)</li>
 *   <li>rateLimitDelay: rate limit 응답 후 고정 대기 (기본 65초)</li>
 *   <li>callDeadline: 호출 한 번의 deadline (기본 120초)</li>
 * </ul>
 *
 * <p>rate limit 대기는 지수 백오프가 아닌 고정 지연이며 maxDelay 상한을 받지 않습니다.
 * Provider의 분당 한도가 풀리기를 기다리는 용도입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 총 시도 횟수 (1 이상)
 * @param baseDelay 기본 대기 (양수)
 * @param maxDelay 최대 대기 (baseDelay 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param rateLimitDelay rate limit 고정 대기 (양수)
 * @param callDeadline 호출 deadline (양수)
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double jitterFactor,
    Duration rateLimitDelay,
    Duration callDeadline
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1s, maxDelay=60s, jitterFactor=0.2,
     * rateLimitDelay=65s, callDeadline=120s</p>
     */
    public RetryPolicy() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, Duration.ofSeconds(65), Duration.ofSeconds(120));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        requirePositive("baseDelay", baseDelay);
        requirePositive("maxDelay", maxDelay);
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        requirePositive("rateLimitDelay", rateLimitDelay);
        requirePositive("callDeadline", callDeadline);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }

    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }

    public RetryPolicy withRateLimitDelay(Duration rateLimitDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }

    public RetryPolicy withCallDeadline(Duration callDeadline) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFactor, rateLimitDelay, callDeadline);
    }
}
