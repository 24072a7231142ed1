package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.exception.ProviderErrorType;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.protection.CircuitBreakerState;

import java.util.Map;

/**
 * 모델별 호출 통계와 건강 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param model 모델
 * @param breakerState Circuit Breaker 상태
 * @param attempts 네트워크 시도 수
 * @param successes 성공 수
 * @param failures 실패 수
 * @param rejections Circuit Breaker에 의해 거부된 호출 수
 * @param retries 재시도 수
 * @param failuresByType 분류별 실패 수
 * @param breakerFailureRate Circuit Breaker 윈도우의 실패율 (0~100, 윈도우가 차지 않았으면 -1)
 */
public record ProviderHealthSnapshot(
    ModelId model,
    CircuitBreakerState breakerState,
    long attempts,
    long successes,
    long failures,
    long rejections,
    long retries,
    Map<ProviderErrorType, Long> failuresByType,
    float breakerFailureRate
) {

    private static final double HEALTHY_SUCCESS_RATE = 0.5;

    public ProviderHealthSnapshot {
        failuresByType = failuresByType == null ? Map.of() : Map.copyOf(failuresByType);
    }

    /**
     * 성공률 (시도가 없으면 1.0).
     */
    public double successRate() {
        long completed = successes + failures;
        return completed == 0 ? 1.0 : (double) successes / completed;
    }

    /**
     * Circuit이 닫혀 있고 성공률이 50% 이상이면 건강한 것으로 판단.
     */
    public boolean healthy() {
        return breakerState == CircuitBreakerState.CLOSED && successRate() >= HEALTHY_SUCCESS_RATE;
    }
}
