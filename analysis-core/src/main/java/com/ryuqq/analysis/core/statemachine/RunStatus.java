package com.ryuqq.analysis.core.statemachine;

/**
 * Run 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED → VALIDATING → ANALYZING → CONSOLIDATING → SYNTHESIZING → VERIFYING → COMPLETED
 *              │             │             │               │             │
 *              └─────────────┴─────────────┴───────────────┴─────────────┴─► ABORTED / CANCELLED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunStatus {

    CREATED,
    VALIDATING,
    ANALYZING,
    CONSOLIDATING,
    SYNTHESIZING,
    VERIFYING,

    /**
     * 모든 단계 성공.
     */
    COMPLETED,

    /**
     * 치명적 실패로 중단.
     */
    ABORTED,

    /**
     * 협조적 취소로 중단.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, ABORTED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == CANCELLED;
    }
}
