package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.application.transaction.ValidatedFramework;
import com.ryuqq.analysis.core.model.Document;

import java.util.List;

/**
 * Prompt builder used by the pipeline phases.
 *
 * <p>Wording is supplied by the caller; the pipeline only depends on the response
 * shape described by each schema method. Schemas are JSON Schema documents passed
 * to the gateway as the tool definition.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnalysisPrompts {

    /**
     * Coherence check for one framework. Expected response:
     * {@code {"coherent": bool, "summary": str, "issues": [str]}}.
     */
    String coherencePrompt(ValidatedFramework framework, Document experiment, Document corpus);

    String coherenceSchema();

    /**
     * Per-document scoring across every framework of the run. Expected response:
     * {@code {"scores": {framework: {dimension: number}}, "evidence": [str]}}.
     */
    String analysisPrompt(List<ValidatedFramework> frameworks, Document document);

    String analysisSchema(List<ValidatedFramework> frameworks);

    /**
     * Analytical synthesis. Expected response:
     * {@code {"report": str, "metrics": {"framework.dimension": number}}}.
     */
    String synthesisPrompt(ConsolidatedAnalysis consolidated, Document experiment);

    String synthesisSchema();

    /**
     * Evidence integration pass over the analytical draft. Expected response:
     * {@code {"report": str}}.
     */
    String evidencePrompt(String draftReport, ConsolidatedAnalysis consolidated);

    String evidenceSchema();
}
