package com.ryuqq.analysis.application.pipeline;

/**
 * 파이프라인 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 문서 분석 동시 실행 수 (Provider rate limit 고려)</li>
 *   <li>failureThreshold: 이 비율을 초과하는 문서가 실패하면 Run 중단</li>
 *   <li>evidenceIntegration: 종합 단계에서 근거 통합 2차 호출 수행 여부</li>
 *   <li>verificationTolerance: 통계 재계산 비교 허용 오차</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineConfig(
    int concurrency,
    double failureThreshold,
    boolean evidenceIntegration,
    double verificationTolerance
) {

    /**
     * 기본 설정 (동시 4개, 실패율 50%, 근거 통합 사용, 허용 오차 0.01).
     */
    public PipelineConfig() {
        this(4, 0.5, true, 0.01);
    }

    public PipelineConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (failureThreshold < 0.0 || failureThreshold > 1.0) {
            throw new IllegalArgumentException("failureThreshold must be between 0.0 and 1.0 (current: " + failureThreshold + ")");
        }
        if (verificationTolerance < 0.0) {
            throw new IllegalArgumentException("verificationTolerance cannot be negative (current: " + verificationTolerance + ")");
        }
    }

    public PipelineConfig withConcurrency(int concurrency) {
        return new PipelineConfig(concurrency, failureThreshold, evidenceIntegration, verificationTolerance);
    }

    public PipelineConfig withFailureThreshold(double failureThreshold) {
        return new PipelineConfig(concurrency, failureThreshold, evidenceIntegration, verificationTolerance);
    }

    public PipelineConfig withEvidenceIntegration(boolean evidenceIntegration) {
        return new PipelineConfig(concurrency, failureThreshold, evidenceIntegration, verificationTolerance);
    }

    public PipelineConfig withVerificationTolerance(double verificationTolerance) {
        return new PipelineConfig(concurrency, failureThreshold, evidenceIntegration, verificationTolerance);
    }

    /**
     * 실패율이 임계값을 초과하는지 확인.
     *
     * @param failed 실패 문서 수
     * @param total 전체 문서 수
     * @return 초과하면 true
     */
    public boolean exceedsThreshold(int failed, int total) {
        return total > 0 && (double) failed / total > failureThreshold;
    }
}
