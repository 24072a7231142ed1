package com.ryuqq.analysis.core.model;

import java.time.Instant;

/**
 * Artifact 목록 조회 조건.
 *
 * <p>모든 조건은 선택 사항이며 null이면 해당 조건을 적용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param hashPrefix 해시 접두사 (null이면 전체)
 * @param createdFrom 생성 시각 하한, 포함 (null이면 제한 없음)
 * @param createdUntil 생성 시각 상한, 미포함 (null이면 제한 없음)
 * @param limit 최대 반환 건수 (1 이상)
 */
public record ArtifactFilter(
    String hashPrefix,
    Instant createdFrom,
    Instant createdUntil,
    int limit
) {

    private static final int DEFAULT_LIMIT = 1000;

    public ArtifactFilter {
        if (hashPrefix != null && !hashPrefix.matches("^[0-9a-f]{1,64}$")) {
            throw new IllegalArgumentException("hashPrefix must be lowercase hex (current: " + hashPrefix + ")");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (createdFrom != null && createdUntil != null && !createdFrom.isBefore(createdUntil)) {
            throw new IllegalArgumentException(
                "createdFrom must be before createdUntil (from: " + createdFrom + ", until: " + createdUntil + ")"
            );
        }
    }

    /**
     * 조건 없는 필터.
     */
    public static ArtifactFilter all() {
        return new ArtifactFilter(null, null, null, DEFAULT_LIMIT);
    }

    public ArtifactFilter withHashPrefix(String hashPrefix) {
        return new ArtifactFilter(hashPrefix, createdFrom, createdUntil, limit);
    }

    public ArtifactFilter withCreatedBetween(Instant createdFrom, Instant createdUntil) {
        return new ArtifactFilter(hashPrefix, createdFrom, createdUntil, limit);
    }

    public ArtifactFilter withLimit(int limit) {
        return new ArtifactFilter(hashPrefix, createdFrom, createdUntil, limit);
    }

    /**
     * Artifact가 조건에 맞는지 확인.
     *
     * @param hash Artifact 해시
     * @param createdAt Artifact 생성 시각
     * @return 모든 조건을 만족하면 true
     */
    public boolean matches(ContentHash hash, Instant createdAt) {
        if (hashPrefix != null && !hash.getValue().startsWith(hashPrefix)) {
            return false;
        }
        if (createdFrom != null && createdAt.isBefore(createdFrom)) {
            return false;
        }
        return createdUntil == null || createdAt.isBefore(createdUntil);
    }
}
