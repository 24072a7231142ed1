package com.ryuqq.analysis.core.exception;

/**
 * 종합 단계 실패 (Run 중단).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
