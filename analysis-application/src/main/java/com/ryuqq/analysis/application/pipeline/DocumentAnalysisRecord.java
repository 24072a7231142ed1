package com.ryuqq.analysis.application.pipeline;

import java.util.List;
import java.util.Map;

/**
 * 문서 하나의 분석 결과 (Artifact로 저장되는 형태).
 *
 * <p>검증 단계는 이 Artifact만으로 통계를 다시 계산합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param documentName 문서 이름
 * @param documentHash 문서 내용 해시
 * @param model 응답한 모델
 * @param scores {@code framework.dimension} → 점수
 * @param evidence 모델이 인용한 근거
 * @param source 추출 경로
 */
public record DocumentAnalysisRecord(
    String documentName,
    String documentHash,
    String model,
    Map<String, Double> scores,
    List<String> evidence,
    String source
) {

    public DocumentAnalysisRecord {
        scores = scores == null ? Map.of() : Map.copyOf(scores);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
