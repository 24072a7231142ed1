/**
 * 검증 캐시 패키지.
 *
 * <p>{@link com.ryuqq.analysis.application.cache.ValidationCacheManager}가 캐시 인덱스의
 * 유일한 writer입니다. 결과 본문은 Artifact Store에 두고 인덱스는 해시만 참조합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.application.cache;
