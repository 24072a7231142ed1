/**
 * Pipeline Orchestrator 구성 요소.
 *
 * <p>단계별 작업자({@link com.ryuqq.analysis.application.pipeline.CoherenceValidator},
 * {@link com.ryuqq.analysis.application.pipeline.DocumentAnalyzer},
 * {@link com.ryuqq.analysis.application.pipeline.Consolidator},
 * {@link com.ryuqq.analysis.application.pipeline.Synthesizer},
 * {@link com.ryuqq.analysis.application.pipeline.StatisticalVerifier})와
 * Run 보고서 타입을 제공합니다. 스레드 풀과 단계 순서는 runner 어댑터가 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.application.pipeline;
