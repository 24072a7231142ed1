package com.ryuqq.analysis.application.pipeline;

import java.util.Map;

/**
 * 종합 단계 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param report 최종 보고서 (근거 통합을 수행했으면 통합본)
 * @param analyticalReport 1차 분석 보고서
 * @param claimedMetrics 보고서가 인용한 차원별 평균 ({@code framework.dimension} → 값)
 * @param evidenceIntegrated 근거 통합 2차 호출 수행 여부
 * @param model 1차 분석에 응답한 모델
 */
public record SynthesisResult(
    String report,
    String analyticalReport,
    Map<String, Double> claimedMetrics,
    boolean evidenceIntegrated,
    String model
) {

    public SynthesisResult {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        analyticalReport = analyticalReport == null ? report : analyticalReport;
        claimedMetrics = claimedMetrics == null ? Map.of() : Map.copyOf(claimedMetrics);
    }
}
