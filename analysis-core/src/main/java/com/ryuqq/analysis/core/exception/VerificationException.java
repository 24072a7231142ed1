package com.ryuqq.analysis.core.exception;

/**
 * 통계 검증 단계 실패 (Run 중단).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
