package com.ryuqq.analysis.application.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 캐시 통계 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param totalEntries 전체 항목 수
 * @param failedEntries FAILED 항목 수
 * @param missingArtifacts Artifact가 사라진 항목 수
 * @param totalBytes 참조 Artifact 총 크기
 * @param hits 누적 Hit 수
 * @param misses 누적 Miss 수
 * @param oldestEntry 가장 오래된 항목 시각 (항목이 없으면 null)
 * @param newestEntry 가장 최근 항목 시각 (항목이 없으면 null)
 * @param entries 항목별 요약
 */
public record CacheStatistics(
    int totalEntries,
    int failedEntries,
    int missingArtifacts,
    long totalBytes,
    long hits,
    long misses,
    Instant oldestEntry,
    Instant newestEntry,
    List<EntrySummary> entries
) {

    public CacheStatistics {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * 항목 하나의 요약.
     *
     * @param key 캐시 키
     * @param model 검증 모델
     * @param status 상태
     * @param size Artifact 크기 (없으면 -1)
     * @param age 항목 나이
     */
    public record EntrySummary(String key, String model, String status, long size, Duration age) {
    }
}
