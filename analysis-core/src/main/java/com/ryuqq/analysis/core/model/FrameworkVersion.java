package com.ryuqq.analysis.core.model;

import java.time.Instant;

/**
 * Framework Registry 행.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>같은 name 안에서 version은 엄격히 증가</li>
 *   <li>(name, contentHash) 쌍마다 최대 한 행</li>
 *   <li>Registry가 유일한 기준이며 로컬 사본은 참고용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 프레임워크 이름
 * @param version 버전 번호 (1부터 시작)
 * @param contentHash 프레임워크 내용 해시 (Artifact Store 참조)
 * @param status 버전 상태
 * @param createdAt 등록 시각
 */
public record FrameworkVersion(
    String name,
    int version,
    ContentHash contentHash,
    FrameworkStatus status,
    Instant createdAt
) {

    public FrameworkVersion {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (contentHash == null) {
            throw new IllegalArgumentException("contentHash cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
