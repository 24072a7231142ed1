package com.ryuqq.analysis.application.cache;

import java.util.List;

/**
 * Coherence 검증 결과.
 *
 * <p>프레임워크, 실험, 코퍼스 조합이 분석 가능한 형태인지 모델이 판단한 결과입니다.
 * Artifact Store에 JSON으로 저장되며 캐시 Hit 시 그대로 복원됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param frameworkName 검증한 프레임워크
 * @param success 분석을 진행해도 되는지 여부
 * @param summary 한 줄 요약
 * @param issues 발견된 문제 목록 (없으면 빈 목록)
 */
public record CoherenceValidation(
    String frameworkName,
    boolean success,
    String summary,
    List<String> issues
) {

    public CoherenceValidation {
        if (frameworkName == null || frameworkName.isBlank()) {
            throw new IllegalArgumentException("frameworkName cannot be null or blank");
        }
        summary = summary == null ? "" : summary;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static CoherenceValidation passed(String frameworkName, String summary) {
        return new CoherenceValidation(frameworkName, true, summary, List.of());
    }

    public static CoherenceValidation failed(String frameworkName, String summary, List<String> issues) {
        return new CoherenceValidation(frameworkName, false, summary, issues);
    }
}
