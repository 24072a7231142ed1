package com.ryuqq.analysis.core.outcome;

/**
 * 문서 하나의 분석 결과.
 *
 * <p>DocumentOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Analyzed}: 구조화 추출 성공, 결과가 Artifact로 저장됨</li>
 *   <li>{@link Failed}: 실패가 기록됨 (Run은 계속 진행)</li>
 * </ul>
 *
 * <p>Consolidation 단계는 모든 문서의 DocumentOutcome이 정해진 뒤에만 시작합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Analyzed analyzed) {
 *     merge(analyzed.scores());
 * } else if (outcome instanceof Failed failed) {
 *     report(failed.kind(), failed.message());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface DocumentOutcome permits Analyzed, Failed {

    /**
     * 문서 이름.
     *
     * @return 문서 이름
     */
    String documentName();

    default boolean isAnalyzed() {
        return this instanceof Analyzed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }
}
