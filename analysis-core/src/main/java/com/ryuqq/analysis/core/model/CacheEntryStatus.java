package com.ryuqq.analysis.core.model;

/**
 * 캐시 항목 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheEntryStatus {

    /**
     * 검증 성공 결과.
     */
    OK,

    /**
     * 검증 실패 결과 ({@code cleanupFailedEntries}로 제거 대상).
     */
    FAILED
}
