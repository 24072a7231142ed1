package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.RunId;

/**
 * 협조적 취소 요청으로 Run이 중단된 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunCancelledException extends RuntimeException {

    private final RunId runId;

    public RunCancelledException(RunId runId) {
        super("Run cancelled: " + runId.getValue());
        this.runId = runId;
    }

    public RunId getRunId() {
        return runId;
    }
}
