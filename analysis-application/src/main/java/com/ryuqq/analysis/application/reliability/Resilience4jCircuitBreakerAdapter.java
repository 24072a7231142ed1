package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.protection.CircuitBreakerConfig;
import com.ryuqq.analysis.core.protection.CircuitBreakerState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Resilience4j 기반 Circuit Breaker Adapter.
 *
 * <p>"연속 N회 실패 시 OPEN"을 Resilience4j의 COUNT_BASED 슬라이딩 윈도우로 표현합니다.</p>
 *
 * <ul>
 *   <li>slidingWindowSize = minimumNumberOfCalls = N, failureRateThreshold = 100%
 *       → 최근 N회가 모두 실패일 때만 OPEN</li>
 *   <li>waitDurationInOpenState = cool-down (경과 후 첫 허가 요청이 HALF_OPEN 전이)</li>
 *   <li>permittedNumberOfCallsInHalfOpenState = 1 → 시험 호출은 하나만 통과</li>
 *   <li>자동 OPEN → HALF_OPEN 전이는 사용하지 않음 (주입한 {@link Clock} 기준으로만 판단)</li>
 * </ul>
 *
 * <p>호출 시간은 deadline에서 따로 다루므로 slow call 판정에는 0을 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Resilience4jCircuitBreakerAdapter implements com.ryuqq.analysis.core.protection.CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jCircuitBreakerAdapter.class);

    private final CircuitBreaker delegate;

    /**
     * 생성자.
     *
     * @param name Circuit 이름 (보통 모델 ID)
     * @param config 실패 임계값과 cool-down
     * @param clock cool-down 판정 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public Resilience4jCircuitBreakerAdapter(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.delegate = new CircuitBreakerStateMachine(name, toResilience4j(config), clock);
        this.delegate.getEventPublisher().onStateTransition(event ->
            log.info("Circuit breaker {} transitioned {} → {}", event.getCircuitBreakerName(),
                event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
    }

    static io.github.resilience4j.circuitbreaker.CircuitBreakerConfig toResilience4j(CircuitBreakerConfig config) {
        return io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.custom()
            .slidingWindowType(io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(config.failureThreshold())
            .minimumNumberOfCalls(config.failureThreshold())
            .failureRateThreshold(100.0f)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(config.coolDown())
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .build();
    }

    @Override
    public boolean tryAcquire() {
        return delegate.tryAcquirePermission();
    }

    @Override
    public void recordSuccess() {
        delegate.onSuccess(0, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordFailure(Throwable cause) {
        delegate.onError(0, TimeUnit.NANOSECONDS,
            cause != null ? cause : new IllegalStateException("Unclassified provider failure"));
    }

    @Override
    public CircuitBreakerState getState() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> CircuitBreakerState.OPEN;
            case HALF_OPEN -> CircuitBreakerState.HALF_OPEN;
            default -> CircuitBreakerState.CLOSED;
        };
    }

    @Override
    public void reset() {
        delegate.reset();
    }

    /**
     * 현재 윈도우의 실패율.
     *
     * @return 0~100, 윈도우가 아직 차지 않았으면 -1
     */
    public float getFailureRate() {
        return delegate.getMetrics().getFailureRate();
    }

    /**
     * 현재 상태에서 거부된 호출 수 (상태 전이 시 초기화).
     */
    public long getNotPermittedCalls() {
        return delegate.getMetrics().getNumberOfNotPermittedCalls();
    }

    /**
     * 현재 윈도우에 기록된 호출 수.
     */
    public int getBufferedCalls() {
        return delegate.getMetrics().getNumberOfBufferedCalls();
    }

    public String getName() {
        return delegate.getName();
    }
}
