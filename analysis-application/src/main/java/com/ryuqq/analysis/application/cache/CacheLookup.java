package com.ryuqq.analysis.application.cache;

import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheKey;

/**
 * 캐시 조회 결과.
 *
 * <p>Miss는 오류가 아닌 제어 흐름입니다. 호출자는 Miss를 받으면 검증을 수행하고
 * {@link ValidationCacheManager#storeValidationResult}로 결과를 저장해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface CacheLookup {

    /**
     * 조회한 키.
     */
    CacheKey key();

    default boolean isHit() {
        return this instanceof Hit;
    }

    /**
     * 캐시 Hit.
     *
     * @param key 캐시 키
     * @param entry 인덱스 항목
     * @param result 저장 당시와 동일한 검증 결과
     */
    record Hit(CacheKey key, CacheEntry entry, CoherenceValidation result) implements CacheLookup {
    }

    /**
     * 캐시 Miss.
     *
     * @param key 캐시 키
     * @param reason Miss 원인
     */
    record Miss(CacheKey key, MissReason reason) implements CacheLookup {
    }

    /**
     * Miss 원인.
     */
    enum MissReason {

        /** 인덱스에 항목 없음. */
        ABSENT,

        /** 항목이 가리키는 Artifact가 없음 (자가 복구). */
        ARTIFACT_MISSING,

        /** Artifact를 역직렬화할 수 없음 (자가 복구). */
        UNREADABLE
    }
}
