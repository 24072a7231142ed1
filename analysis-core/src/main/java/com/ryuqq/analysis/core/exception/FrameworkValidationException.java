package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.RollbackGuidance;

/**
 * 하나 이상의 프레임워크가 검증에 실패해 Run이 중단된 경우.
 *
 * <p>이 예외가 호출자에게 보일 때는 이미 롤백이 끝난 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FrameworkValidationException extends RuntimeException {

    private final RollbackGuidance guidance;

    public FrameworkValidationException(RollbackGuidance guidance) {
        super("Framework validation failed: " + guidance.failedFrameworkNames());
        this.guidance = guidance;
    }

    public FrameworkValidationException(RollbackGuidance guidance, Throwable cause) {
        super("Framework validation aborted: " + guidance.failedFrameworkNames(), cause);
        this.guidance = guidance;
    }

    public RollbackGuidance getGuidance() {
        return guidance;
    }
}
