package com.ryuqq.analysis.core.exception;

/**
 * 문서 분석 실패율이 임계값을 넘어 Run을 중단한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FailureThresholdExceededException extends RuntimeException {

    private final int failed;
    private final int total;
    private final double threshold;

    public FailureThresholdExceededException(int failed, int total, double threshold) {
        super(String.format("Document failure rate %d/%d exceeds threshold %.2f", failed, total, threshold));
        this.failed = failed;
        this.total = total;
        this.threshold = threshold;
    }

    public int getFailed() {
        return failed;
    }

    public int getTotal() {
        return total;
    }

    public double getThreshold() {
        return threshold;
    }
}
