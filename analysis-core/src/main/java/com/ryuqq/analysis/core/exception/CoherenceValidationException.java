package com.ryuqq.analysis.core.exception;

/**
 * 프레임워크/실험/코퍼스 조합의 coherence 검증 실패 (Run 중단).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CoherenceValidationException extends RuntimeException {

    private final String frameworkName;

    public CoherenceValidationException(String frameworkName, String message) {
        super(message);
        this.frameworkName = frameworkName;
    }

    public String getFrameworkName() {
        return frameworkName;
    }
}
