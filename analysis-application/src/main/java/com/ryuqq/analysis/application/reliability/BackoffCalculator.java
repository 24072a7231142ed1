package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.exception.ProviderErrorType;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 여러 worker가 같은 순간에 다시 몰리는 것을 방지합니다.
 * rate limit 오류는 별도의 고정 지연 구간을 사용합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * 일반 오류:   delay = min(base * 2^(attempt-1) + jitter, maxDelay)
 *              jitter = random(0, exponential * jitterFactor)
 * rate limit:  delay = rateLimitDelay + random(0, rateLimitDelay * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (base=1s, jitterFactor=0.2, rateLimitDelay=65s):</strong></p>
 * <ul>
 *   <li>attempt=1 timeout: 1000-1200ms</li>
 *   <li>attempt=2 5xx: 2000-2400ms</li>
 *   <li>attempt=1 rate limit: 65000-78000ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final RetryPolicy policy;
    private final DoubleSupplier random;

    /**
     * 기본 정책으로 생성.
     */
    public BackoffCalculator() {
        this(new RetryPolicy());
    }

    public BackoffCalculator(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 난수원으로 생성.
     *
     * @param policy 재시도 정책
     * @param random [0.0, 1.0) 난수 공급자 (테스트에서 고정값 주입)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy, DoubleSupplier random) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.policy = policy;
        this.random = random;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attemptCount 실패한 시도 번호 (1부터 시작)
     * @param errorType 실패 분류
     * @return 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아니거나 errorType이 null인 경우
     */
    public Duration calculate(int attemptCount, ProviderErrorType errorType) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }

        if (errorType == ProviderErrorType.RATE_LIMIT) {
            long fixed = policy.rateLimitDelay().toMillis();
            long jitter = (long) (fixed * policy.jitterFactor() * random.getAsDouble());
            return Duration.ofMillis(fixed + jitter);
        }

        long baseDelayMs = policy.baseDelay().toMillis();
        long maxDelayMs = policy.maxDelay().toMillis();

        // 1. 지수적 백오프 (shift overflow 방지)
        int shift = Math.min(attemptCount - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * policy.jitterFactor() * random.getAsDouble());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
