/**
 * Provider Reliability Layer.
 *
 * <p>모델 호출을 재시도, Circuit Breaker, Failover, deadline으로 감싸
 * 불안정한 원격 Provider를 예측 가능한 배치 작업처럼 다룹니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.analysis.application.reliability.ReliableModelClient} - 호출 진입점</li>
 *   <li>{@link com.ryuqq.analysis.application.reliability.RetryPolicy} - 재시도 설정</li>
 *   <li>{@link com.ryuqq.analysis.application.reliability.BackoffCalculator} - 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.analysis.application.reliability.ErrorClassifier} - 재시도 대상 판별</li>
 *   <li>{@link com.ryuqq.analysis.application.reliability.Resilience4jCircuitBreakerAdapter} - 모델별 Circuit Breaker</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.application.reliability;
