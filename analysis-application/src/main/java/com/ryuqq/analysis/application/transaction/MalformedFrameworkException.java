package com.ryuqq.analysis.application.transaction;

/**
 * 프레임워크 정의를 구조적으로 해석할 수 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MalformedFrameworkException extends RuntimeException {

    public MalformedFrameworkException(String message) {
        super(message);
    }

    public MalformedFrameworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
