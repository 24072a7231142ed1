package com.ryuqq.analysis.application.pipeline;

import java.util.List;

/**
 * 통계 재계산 검증 결과.
 *
 * <p>불일치는 Run을 중단하지 않고 보고서에 표시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param tolerance 허용 오차
 * @param documentCount 재계산에 사용한 문서 수
 * @param checks 비교 항목 전체
 */
public record VerificationReport(double tolerance, int documentCount, List<Check> checks) {

    public VerificationReport {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public boolean passed() {
        return checks.stream().allMatch(Check::passed);
    }

    public List<Check> discrepancies() {
        return checks.stream().filter(check -> !check.passed()).toList();
    }

    /**
     * 비교 대상.
     */
    public enum Target {

        /** 병합 단계의 평균. */
        CONSOLIDATION,

        /** 종합 보고서가 인용한 평균. */
        SYNTHESIS
    }

    /**
     * 비교 항목 하나.
     *
     * @param key {@code framework.dimension}
     * @param target 비교 대상
     * @param expected 재계산 값 (재계산할 수 없으면 NaN)
     * @param reported 대상이 보고한 값 (보고하지 않았으면 NaN)
     * @param passed 허용 오차 이내 여부
     */
    public record Check(String key, Target target, double expected, double reported, boolean passed) {

        public double difference() {
            return Math.abs(expected - reported);
        }
    }
}
