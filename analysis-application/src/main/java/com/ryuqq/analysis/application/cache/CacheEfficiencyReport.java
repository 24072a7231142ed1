package com.ryuqq.analysis.application.cache;

import java.util.List;

/**
 * 캐시 효율 리포트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param hits 누적 Hit 수
 * @param misses 누적 Miss 수
 * @param hitRate 적중률 (0.0 ~ 1.0)
 * @param efficiency 등급
 * @param totalEntries 전체 항목 수
 * @param staleEntries 일주일 이상 된 항목 수
 * @param failedEntries FAILED 항목 수
 * @param totalBytes 항목이 가리키는 Artifact 전체 크기
 * @param sizeEfficiency 크기 등급
 * @param recommendations 운영 권고
 */
public record CacheEfficiencyReport(
    long hits,
    long misses,
    double hitRate,
    CacheEfficiency efficiency,
    int totalEntries,
    int staleEntries,
    int failedEntries,
    long totalBytes,
    SizeEfficiency sizeEfficiency,
    List<String> recommendations
) {

    public CacheEfficiencyReport {
        sizeEfficiency = sizeEfficiency == null ? SizeEfficiency.classify(totalBytes) : sizeEfficiency;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * 캐시 크기 등급.
     *
     * <ul>
     *   <li>GOOD: 100MB 미만</li>
     *   <li>MODERATE: 500MB 이하</li>
     *   <li>HIGH: 500MB 초과 (정리 권고)</li>
     * </ul>
     */
    public enum SizeEfficiency {
        GOOD,
        MODERATE,
        HIGH;

        static final long GOOD_LIMIT_BYTES = 100L * 1024 * 1024;
        static final long MODERATE_LIMIT_BYTES = 500L * 1024 * 1024;

        public static SizeEfficiency classify(long totalBytes) {
            if (totalBytes < GOOD_LIMIT_BYTES) {
                return GOOD;
            }
            return totalBytes <= MODERATE_LIMIT_BYTES ? MODERATE : HIGH;
        }
    }
}
