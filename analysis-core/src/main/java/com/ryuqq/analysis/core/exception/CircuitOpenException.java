package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ModelId;

import java.util.List;

/**
 * 모든 경로의 Circuit Breaker가 열려 있어 네트워크 호출 없이 거부된 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RuntimeException {

    private final List<ModelId> rejectedModels;

    public CircuitOpenException(List<ModelId> rejectedModels) {
        super("Circuit breaker is OPEN for all routes: " + rejectedModels);
        this.rejectedModels = List.copyOf(rejectedModels);
    }

    public List<ModelId> getRejectedModels() {
        return rejectedModels;
    }
}
