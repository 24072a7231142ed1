package com.ryuqq.analysis.core.model;

/**
 * 감사 이벤트 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AuditEventType {
    RUN_STARTED,
    PHASE_STARTED,
    PHASE_COMPLETED,
    FRAMEWORK_VALIDATED,
    FRAMEWORK_REJECTED,
    FRAMEWORK_VERSION_MINTING,
    FRAMEWORK_VERSION_ROLLED_BACK,
    FRAMEWORK_COMMITTED,
    CACHE_HIT,
    CACHE_MISS,
    VALIDATION_RESULT_STORED,
    DOCUMENT_ANALYZED,
    DOCUMENT_FAILED,
    RESULTS_CONSOLIDATED,
    SYNTHESIS_STORED,
    VERIFICATION_STORED,
    RUN_COMPLETED,
    RUN_ABORTED
}
