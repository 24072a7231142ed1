package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ModelId;

/**
 * 모델 Provider 호출 실패의 최상위 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ProviderException extends RuntimeException {

    private final ModelId model;
    private final ProviderErrorType errorType;

    protected ProviderException(ModelId model, ProviderErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        this.model = model;
        this.errorType = errorType;
    }

    /**
     * 실패한 모델 (Gateway가 모델을 특정하지 못한 경우 null).
     */
    public ModelId getModel() {
        return model;
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
