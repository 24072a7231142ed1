/**
 * Provider 보호 장치 패키지.
 *
 * <p>모델별 Circuit Breaker 상태 머신을 정의합니다. 재시도 카운터나 차단 플래그를
 * 호출부에 흩어두지 않고, 모델마다 하나의 {@link com.ryuqq.analysis.core.protection.CircuitBreaker}
 * 인스턴스가 상태를 소유합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.protection;
