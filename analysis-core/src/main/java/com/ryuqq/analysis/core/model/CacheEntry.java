package com.ryuqq.analysis.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 검증 캐시 인덱스 항목.
 *
 * <p>결과 본문은 Artifact Store에 있으며, 이 항목은 해시 참조만 가집니다.
 * 참조된 Artifact가 없으면 캐시 조회는 Miss로 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param key 캐시 키
 * @param artifactRef 직렬화된 검증 결과의 해시
 * @param producingModel 결과를 만든 모델
 * @param createdAt 저장 시각
 * @param status 검증 성공 여부
 */
public record CacheEntry(
    CacheKey key,
    ContentHash artifactRef,
    ModelId producingModel,
    Instant createdAt,
    CacheEntryStatus status
) {

    public CacheEntry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (artifactRef == null) {
            throw new IllegalArgumentException("artifactRef cannot be null");
        }
        if (producingModel == null) {
            throw new IllegalArgumentException("producingModel cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 기준 시각 대비 항목 나이.
     *
     * @param now 기준 시각
     * @return 경과 시간 (음수가 되지 않음)
     */
    public Duration age(Instant now) {
        Duration age = Duration.between(createdAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public boolean isFailed() {
        return status == CacheEntryStatus.FAILED;
    }
}
