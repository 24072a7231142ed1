package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.model.RunId;

/**
 * Pipeline Orchestrator entry point.
 *
 * <p>Runs validation, analysis, consolidation, synthesis and verification in order.
 * Every run ends with a {@link RunReport}; failures are reported through the report's
 * status and failure fields rather than thrown, except for invalid arguments.</p>
 *
 * <p><strong>Thread Safety:</strong> implementations must support concurrent runs with
 * distinct run ids and {@link #cancel(RunId)} from any thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnalysisPipeline {

    /**
     * Executes a run to completion, abort or cancellation.
     *
     * @param request the run request
     * @return the final report (status is always terminal)
     * @throws IllegalArgumentException if request is null
     */
    RunReport run(RunRequest request);

    /**
     * Requests cooperative cancellation of an active run.
     *
     * <p>The flag is checked between documents and between phases; in-flight calls finish
     * within their deadline.</p>
     *
     * @param runId the run to cancel
     * @return true if the run was active
     */
    boolean cancel(RunId runId);
}
