package com.ryuqq.analysis.application.transaction;

import com.ryuqq.analysis.core.model.FrameworkFailureKind;
import com.ryuqq.analysis.core.statemachine.FrameworkValidationState;

/**
 * 프레임워크 하나의 검증 결과.
 *
 * <p>검증이 끝난 프레임워크는 {@link Valid} 또는 {@link Invalid} 중 하나이며,
 * "부분적으로 유효한" 상태는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface FrameworkValidation {

    /**
     * 프레임워크 이름.
     */
    String name();

    /**
     * 검증 직후 상태.
     */
    FrameworkValidationState state();

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * 검증 통과.
     *
     * @param framework 사용할 프레임워크
     */
    record Valid(ValidatedFramework framework) implements FrameworkValidation {

        public Valid {
            if (framework == null) {
                throw new IllegalArgumentException("framework cannot be null");
            }
        }

        @Override
        public String name() {
            return framework.name();
        }

        @Override
        public FrameworkValidationState state() {
            return FrameworkValidationState.VALID;
        }
    }

    /**
     * 검증 실패.
     *
     * @param name 프레임워크 이름
     * @param state 실패 상태 (CONTENT_CHANGED, VERSION_MISMATCH, MISSING, MALFORMED)
     * @param kind 실패 분류
     * @param detail 구체적인 원인
     */
    record Invalid(
        String name,
        FrameworkValidationState state,
        FrameworkFailureKind kind,
        String detail
    ) implements FrameworkValidation {

        public Invalid {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (state == null || !state.isFailure()) {
                throw new IllegalArgumentException("state must be a failure state (current: " + state + ")");
            }
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            detail = detail == null ? "" : detail;
        }
    }
}
