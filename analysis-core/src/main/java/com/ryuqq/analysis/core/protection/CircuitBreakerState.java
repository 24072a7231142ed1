package com.ryuqq.analysis.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 N회)
 * OPEN (차단, 네트워크 호출 없음)
 *   │
 *   ▼ (cool-down 경과 후 첫 호출)
 * HALF_OPEN (시험 호출 1건만 허용)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 통과시키며 연속 실패를 셉니다.
     */
    CLOSED,

    /**
     * 차단 상태. cool-down이 끝날 때까지 모든 호출을 즉시 거부합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 시험 호출 하나의 결과로 다음 상태가 정해집니다.
     */
    HALF_OPEN
}
