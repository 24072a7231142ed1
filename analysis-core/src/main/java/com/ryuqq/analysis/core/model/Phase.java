package com.ryuqq.analysis.core.model;

/**
 * 파이프라인 단계 (실행 순서대로 선언).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Phase {
    VALIDATION,
    ANALYSIS,
    CONSOLIDATION,
    SYNTHESIS,
    VERIFICATION
}
