package com.ryuqq.analysis.application.pipeline;

import java.util.List;

/**
 * Run 성능 점수 (0~100).
 *
 * <pre>
 * 100
 *   - 30초를 넘은 단계마다 min(20, 초과 초)
 *   + 10 (캐시 적중률 &gt; 80%)
 *   - 10 (캐시 적중률 &lt; 50%, 조회가 없으면 0%로 계산)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PerformanceScore {

    static final double SLOW_PHASE_SECONDS = 30.0;
    static final double MAX_PHASE_PENALTY = 20.0;
    static final double CACHE_ADJUSTMENT = 10.0;

    private PerformanceScore() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static double calculate(List<PhaseTiming> timings, long cacheHits, long cacheMisses) {
        double score = 100.0;

        for (PhaseTiming timing : timings) {
            double seconds = timing.duration().toMillis() / 1000.0;
            if (seconds > SLOW_PHASE_SECONDS) {
                score -= Math.min(MAX_PHASE_PENALTY, seconds - SLOW_PHASE_SECONDS);
            }
        }

        double hitRate = (double) cacheHits / Math.max(1, cacheHits + cacheMisses);
        if (hitRate > 0.8) {
            score += CACHE_ADJUSTMENT;
        } else if (hitRate < 0.5) {
            score -= CACHE_ADJUSTMENT;
        }

        return Math.max(0.0, Math.min(100.0, score));
    }
}
