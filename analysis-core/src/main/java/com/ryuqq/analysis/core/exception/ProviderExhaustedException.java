package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ModelId;

/**
 * 재시도 예산을 모두 소진한 경우.
 *
 * <p>마지막 {@link TransientProviderException}을 원인으로 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProviderExhaustedException extends RuntimeException {

    private final ModelId model;
    private final int attempts;

    public ProviderExhaustedException(ModelId model, int attempts, Throwable lastFailure) {
        super("Retries exhausted for " + model + " after " + attempts + " attempt(s)", lastFailure);
        this.model = model;
        this.attempts = attempts;
    }

    public ModelId getModel() {
        return model;
    }

    public int getAttempts() {
        return attempts;
    }
}
