package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.model.Phase;

import java.time.Duration;
import java.time.Instant;

/**
 * 단계 하나의 실행 기록.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param phase 단계
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각
 * @param cacheHits 단계 중 캐시 Hit 수
 * @param cacheMisses 단계 중 캐시 Miss 수
 */
public record PhaseTiming(
    Phase phase,
    Instant startedAt,
    Instant finishedAt,
    int cacheHits,
    int cacheMisses
) {

    public PhaseTiming {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (startedAt == null || finishedAt == null) {
            throw new IllegalArgumentException("startedAt and finishedAt cannot be null");
        }
        if (finishedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("finishedAt cannot be before startedAt");
        }
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
