package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ModelId;

/**
 * 재시도 가능한 Provider 오류 (timeout, 5xx, rate limit, 과부하).
 *
 * <p>Provider Reliability Layer 밖으로는 재시도 예산이 소진된 경우에만
 * {@link ProviderExhaustedException}의 원인으로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(ModelId model, ProviderErrorType errorType, String message) {
        this(model, errorType, message, null);
    }

    public TransientProviderException(ModelId model, ProviderErrorType errorType, String message, Throwable cause) {
        super(model, requireRetryable(errorType), message, cause);
    }

    private static ProviderErrorType requireRetryable(ProviderErrorType errorType) {
        if (errorType != null && !errorType.isRetryable()) {
            throw new IllegalArgumentException("errorType must be retryable (current: " + errorType + ")");
        }
        return errorType;
    }
}
