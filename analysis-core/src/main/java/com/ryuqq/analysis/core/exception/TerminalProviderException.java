package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ModelId;

/**
 * 재시도하지 않는 Provider 오류 (인증 실패, 잘못된 요청).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TerminalProviderException extends ProviderException {

    public TerminalProviderException(ModelId model, ProviderErrorType errorType, String message) {
        this(model, errorType, message, null);
    }

    public TerminalProviderException(ModelId model, ProviderErrorType errorType, String message, Throwable cause) {
        super(model, requireTerminal(errorType), message, cause);
    }

    private static ProviderErrorType requireTerminal(ProviderErrorType errorType) {
        if (errorType != null && errorType.isRetryable()) {
            throw new IllegalArgumentException("errorType must not be retryable (current: " + errorType + ")");
        }
        return errorType;
    }
}
