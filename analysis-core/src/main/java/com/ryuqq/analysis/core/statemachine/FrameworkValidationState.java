package com.ryuqq.analysis.core.statemachine;

/**
 * Run 안에서 프레임워크 참조 하나의 검증 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNVALIDATED
 *    │
 *    ├─► VALID ──────────────┬─► COMMITTED
 *    ├─► CONTENT_CHANGED ─► VALID (새 버전 발급)
 *    ├─► VERSION_MISMATCH    │
 *    ├─► MISSING             │
 *    └─► MALFORMED ──────────┴─► ROLLED_BACK
 * </pre>
 *
 * <p>CONTENT_CHANGED에서 버전 발급에 실패하면 그 상태로 남아 실패로 취급됩니다.
 * 검증 도중 예외로 끝난 UNVALIDATED 참조는 바로 ROLLED_BACK으로 전이할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FrameworkValidationState {

    /**
     * 아직 검증하지 않음.
     */
    UNVALIDATED,

    /**
     * Registry와 내용이 일치 (또는 새 버전 발급 완료).
     */
    VALID,

    /**
     * 로컬 사본이 최신 Registry 내용과 다름.
     */
    CONTENT_CHANGED,

    /**
     * 고정한 버전이 Registry에 없거나 로컬 사본과 다름.
     */
    VERSION_MISMATCH,

    /**
     * Registry 항목 없음 또는 로컬 사본을 읽을 수 없음.
     */
    MISSING,

    /**
     * 구조적으로 잘못된 정의.
     */
    MALFORMED,

    /**
     * 트랜잭션 커밋 완료.
     */
    COMMITTED,

    /**
     * 트랜잭션 롤백 완료.
     */
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMMITTED 또는 ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }

    /**
     * 검증 실패 상태인지 확인.
     *
     * @return CONTENT_CHANGED(미해결), VERSION_MISMATCH, MISSING, MALFORMED인 경우 true
     */
    public boolean isFailure() {
        return this == CONTENT_CHANGED || this == VERSION_MISMATCH || this == MISSING || this == MALFORMED;
    }
}
