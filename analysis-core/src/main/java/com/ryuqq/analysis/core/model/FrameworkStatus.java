package com.ryuqq.analysis.core.model;

/**
 * Registry에 기록된 프레임워크 버전 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FrameworkStatus {

    /**
     * 명시적 import로 등록된 버전.
     */
    ACTIVE,

    /**
     * 검증 중 로컬 사본 변경을 감지해 자동 발급된 버전.
     */
    DRAFT
}
