package com.ryuqq.analysis.core.outcome;

import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;

import java.util.Map;

/**
 * 분석 성공.
 *
 * @param documentName 문서 이름
 * @param artifactRef 저장된 분석 결과의 해시
 * @param model 실제로 응답한 모델
 * @param scores 차원별 점수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Analyzed(
    String documentName,
    ContentHash artifactRef,
    ModelId model,
    Map<String, Double> scores
) implements DocumentOutcome {

    public Analyzed {
        if (documentName == null || documentName.isBlank()) {
            throw new IllegalArgumentException("documentName cannot be null or blank");
        }
        if (artifactRef == null) {
            throw new IllegalArgumentException("artifactRef cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }
}
