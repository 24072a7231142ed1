package com.ryuqq.analysis.application.transaction;

import java.util.List;

/**
 * 구조 검증을 통과한 프레임워크 정의.
 *
 * <p>외부에서 작성된 느슨한 형식의 내용을 Orchestrator로 넘기기 전에
 * 이 타입으로 고정합니다. 원시 Map은 파이프라인을 통과하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 정의에 적힌 이름
 * @param description 설명 (없으면 빈 문자열)
 * @param dimensions 분석 차원 (1개 이상)
 */
public record FrameworkDefinition(
    String name,
    String description,
    List<Dimension> dimensions
) {

    public FrameworkDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("dimensions cannot be null or empty");
        }
        description = description == null ? "" : description;
        dimensions = List.copyOf(dimensions);
    }

    /**
     * 차원 이름 목록.
     */
    public List<String> dimensionNames() {
        return dimensions.stream().map(Dimension::name).toList();
    }

    /**
     * 분석 차원.
     *
     * @param name 차원 이름 (점수 키)
     * @param description 채점 기준 설명
     * @param minScore 최소 점수
     * @param maxScore 최대 점수
     */
    public record Dimension(String name, String description, double minScore, double maxScore) {

        public Dimension {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("dimension name cannot be null or blank");
            }
            if (minScore >= maxScore) {
                throw new IllegalArgumentException(
                    "minScore must be less than maxScore (dimension: " + name + ", min: " + minScore + ", max: " + maxScore + ")"
                );
            }
            description = description == null ? "" : description;
        }
    }
}
