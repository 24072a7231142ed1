package com.ryuqq.analysis.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>모델 하나의 연속 실패를 추적하고, 임계값에 도달하면 네트워크 호출 없이
 * 빠르게 실패(Fail-Fast)하여 장애가 Run 전체로 번지는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * if (!cb.tryAcquire()) {
 *     // OPEN 상태: 보조 모델로 Failover
 *     return failover(request);
 * }
 *
 * try {
 *     ModelResponse response = gateway.invoke(request);
 *     cb.recordSuccess();
 *     return response;
 * } catch (TransientProviderException e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: cool-down 전에는 false, 경과 후에는 HALF_OPEN으로 전이하며 시험 호출 1건만 true</li>
     *   <li>HALF_OPEN: 시험 호출이 진행 중이면 false</li>
     * </ul>
     *
     * @return true: 호출 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 호출 성공 기록. 연속 실패 수를 0으로 되돌리고 HALF_OPEN이면 CLOSED로 전이합니다.
     */
    void recordSuccess();

    /**
     * 호출 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 수가 임계값에 도달하면 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 시험 호출 실패, 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
