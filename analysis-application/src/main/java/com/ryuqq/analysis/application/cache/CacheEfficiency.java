package com.ryuqq.analysis.application.cache;

/**
 * 캐시 적중률 등급 (운영 참고용).
 *
 * <ul>
 *   <li>HIGH: 80% 이상</li>
 *   <li>MEDIUM: 50% 이상</li>
 *   <li>LOW: 50% 미만</li>
 *   <li>NONE: 조회 이력 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CacheEfficiency {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    private static final double HIGH_THRESHOLD = 0.8;
    private static final double MEDIUM_THRESHOLD = 0.5;

    /**
     * Hit/Miss 수로 등급 분류.
     *
     * @param hits Hit 수
     * @param misses Miss 수
     * @return 등급
     */
    public static CacheEfficiency classify(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) {
            return NONE;
        }
        double hitRate = (double) hits / total;
        if (hitRate >= HIGH_THRESHOLD) {
            return HIGH;
        }
        return hitRate >= MEDIUM_THRESHOLD ? MEDIUM : LOW;
    }
}
