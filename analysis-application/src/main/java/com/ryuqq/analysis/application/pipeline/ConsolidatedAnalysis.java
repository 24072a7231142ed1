package com.ryuqq.analysis.application.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * 문서별 결과를 차원별로 합친 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param documents 포함된 (성공한) 문서 이름, 이름 순
 * @param dimensions 차원별 요약, 키 순
 */
public record ConsolidatedAnalysis(List<String> documents, List<DimensionSummary> dimensions) {

    public ConsolidatedAnalysis {
        documents = documents == null ? List.of() : List.copyOf(documents);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    public Optional<DimensionSummary> dimension(String key) {
        return dimensions.stream().filter(summary -> summary.key().equals(key)).findFirst();
    }

    public int documentCount() {
        return documents.size();
    }

    /**
     * 차원 하나의 요약 통계.
     *
     * @param key {@code framework.dimension}
     * @param count 점수가 있는 문서 수
     * @param mean 평균
     * @param min 최소
     * @param max 최대
     */
    public record DimensionSummary(String key, int count, double mean, double min, double max) {

        public DimensionSummary {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            if (count <= 0) {
                throw new IllegalArgumentException("count must be positive (current: " + count + ")");
            }
        }
    }
}
