package com.ryuqq.analysis.application.cache;

import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.model.Artifact;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheEntryStatus;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import com.ryuqq.analysis.core.spi.AuditLog;
import com.ryuqq.analysis.core.spi.CacheIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coherence 검증 결과 캐시 관리자.
 *
 * <p>프레임워크, 실험, 코퍼스, 모델이 바뀌지 않았다면 비용이 큰 LLM 검증을
 * 다시 수행하지 않도록 결과를 Artifact Store에 보관하고 인덱스로 찾습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * key = generateCacheKey(framework, experiment, corpus, model)
 * checkCache(key)
 *   ├─ Hit  → 저장된 결과 그대로 사용
 *   └─ Miss → 검증 수행 → storeValidationResult(key, result, model)
 * </pre>
 *
 * <p><strong>자가 복구:</strong> 인덱스 항목이 가리키는 Artifact가 없거나 읽을 수 없으면
 * (저장소 I/O 오류 포함) 예외 없이 Miss를 반환합니다. 다음 저장이 항목을 덮어씁니다.</p>
 *
 * <p><strong>동시성:</strong> 같은 키에 대한 쓰기와 정리는 고정 크기 lock stripe로 직렬화되고,
 * 조회는 잠금 없이 수행됩니다.</p>
 *
 * <p><strong>효율 리포트:</strong> Hit/Miss 수는 감사 로그에 남은 CACHE_HIT/CACHE_MISS 이벤트에서
 * 집계하므로 별도 프로세스(CLI)에서도 누적 값을 봅니다. 감사 기록이 없으면 이 프로세스의
 * 조회 카운터를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationCacheManager {

    private static final Logger log = LoggerFactory.getLogger(ValidationCacheManager.class);

    /**
     * 오래된 항목으로 보는 기준.
     */
    static final Duration STALE_AGE = Duration.ofDays(7);

    /**
     * 오래된 항목 비율이 이 값을 넘으면 정리를 권고.
     */
    static final double STALE_RATIO_THRESHOLD = 0.3;

    /**
     * 전체 Artifact 크기가 이 값을 넘으면 정리를 권고.
     */
    static final long LARGE_CACHE_BYTES = CacheEfficiencyReport.SizeEfficiency.MODERATE_LIMIT_BYTES;

    /**
     * 쓰기 잠금 stripe 수.
     */
    static final int LOCK_STRIPES = 64;

    private final ArtifactStore artifactStore;
    private final CacheIndex cacheIndex;
    private final AuditLog auditLog;
    private final Clock clock;

    private final Object[] keyLocks = new Object[LOCK_STRIPES];
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * 생성자.
     *
     * @param artifactStore 결과 본문 저장소
     * @param cacheIndex 캐시 인덱스
     * @param auditLog 감사 로그
     * @param clock 항목 시각 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ValidationCacheManager(ArtifactStore artifactStore, CacheIndex cacheIndex, AuditLog auditLog, Clock clock) {
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (cacheIndex == null) {
            throw new IllegalArgumentException("cacheIndex cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.artifactStore = artifactStore;
        this.cacheIndex = cacheIndex;
        this.auditLog = auditLog;
        this.clock = clock;
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new Object();
        }
    }

    /**
     * 캐시 키 계산.
     *
     * <p>네 입력의 전체 내용만 사용하며 파일 경로와 시각은 반영하지 않습니다.
     * 어느 입력이든 한 바이트만 달라져도 다른 키가 됩니다.</p>
     *
     * @param framework 프레임워크 내용
     * @param experiment 실험 정의 내용
     * @param corpus 코퍼스 내용
     * @param model 검증 모델
     * @return 캐시 키
     */
    public CacheKey generateCacheKey(byte[] framework, byte[] experiment, byte[] corpus, ModelId model) {
        return CacheKey.derive(framework, experiment, corpus, model);
    }

    /**
     * 캐시 조회.
     *
     * @param key 캐시 키
     * @return Hit(저장된 결과) 또는 Miss(원인)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public CacheLookup checkCache(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        Optional<CacheEntry> entry = cacheIndex.find(key);
        if (entry.isEmpty()) {
            return miss(key, CacheLookup.MissReason.ABSENT);
        }

        Optional<Artifact> artifact;
        try {
            artifact = artifactStore.find(entry.get().artifactRef());
        } catch (ArtifactStoreException e) {
            log.warn("Cache entry {} artifact {} could not be read, treating as miss: {}",
                key, entry.get().artifactRef(), e.getMessage());
            return miss(key, CacheLookup.MissReason.UNREADABLE);
        }
        if (artifact.isEmpty()) {
            log.warn("Cache entry {} references missing artifact {}, treating as miss", key, entry.get().artifactRef());
            return miss(key, CacheLookup.MissReason.ARTIFACT_MISSING);
        }

        try {
            CoherenceValidation result = JsonCodec.read(artifact.get().getBytes(), CoherenceValidation.class);
            hits.incrementAndGet();
            log.info("Validation cache hit: {} (model: {}, status: {})", key, entry.get().producingModel(), entry.get().status());
            return new CacheLookup.Hit(key, entry.get(), result);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.warn("Cache entry {} has unreadable artifact {}, treating as miss: {}", key, entry.get().artifactRef(), e.getMessage());
            return miss(key, CacheLookup.MissReason.UNREADABLE);
        }
    }

    /**
     * 검증 결과 저장 (감사 이벤트 없음).
     *
     * @param key 캐시 키
     * @param result 검증 결과
     * @param model 결과를 만든 모델
     * @return 기록된 인덱스 항목
     */
    public CacheEntry storeValidationResult(CacheKey key, CoherenceValidation result, ModelId model) {
        return store(null, key, result, model);
    }

    /**
     * 검증 결과 저장.
     *
     * <p>결과를 Artifact로 쓴 뒤 감사 이벤트를 남기고, 마지막으로 인덱스 항목을 기록합니다.
     * 인덱스 항목이 보이는 시점에는 Artifact와 감사 이벤트가 이미 존재합니다.</p>
     *
     * @param runId 결과를 만든 Run
     * @param key 캐시 키
     * @param result 검증 결과
     * @param model 결과를 만든 모델
     * @return 기록된 인덱스 항목
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CacheEntry storeValidationResult(RunId runId, CacheKey key, CoherenceValidation result, ModelId model) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return store(runId, key, result, model);
    }

    private CacheEntry store(RunId runId, CacheKey key, CoherenceValidation result, ModelId model) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }

        synchronized (lockFor(key)) {
            ContentHash artifactRef = artifactStore.put(JsonCodec.write(result));
            CacheEntryStatus status = result.success() ? CacheEntryStatus.OK : CacheEntryStatus.FAILED;
            Instant now = clock.instant();

            if (runId != null) {
                auditLog.append(new AuditEvent(runId, Phase.VALIDATION, AuditEventType.VALIDATION_RESULT_STORED,
                    artifactRef, key.getValue() + " " + status, now));
            }

            CacheEntry entry = new CacheEntry(key, artifactRef, model, now, status);
            cacheIndex.put(entry);
            log.info("Validation result cached: {} → {} (status: {})", key, artifactRef, status);
            return entry;
        }
    }

    /**
     * 오래된 항목 정리.
     *
     * <p>인덱스 항목만 제거하며 Artifact는 남습니다 (Artifact Store는 추가 전용).</p>
     *
     * @param maxAge 허용 최대 나이
     * @return 제거한 항목 수
     * @throws IllegalArgumentException maxAge가 음수이거나 null인 경우
     */
    public int cleanupOldEntries(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative (current: " + maxAge + ")");
        }
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : cacheIndex.entries()) {
            if (entry.age(now).compareTo(maxAge) > 0 && removeUnderLock(entry)) {
                removed++;
            }
        }
        log.info("Cache cleanup completed: {} entries older than {} removed", removed, maxAge);
        return removed;
    }

    /**
     * FAILED 항목 정리.
     *
     * @return 제거한 항목 수
     */
    public int cleanupFailedEntries() {
        int removed = 0;
        for (CacheEntry entry : cacheIndex.entries()) {
            if (entry.isFailed() && removeUnderLock(entry)) {
                removed++;
            }
        }
        log.info("Cache cleanup completed: {} failed entries removed", removed);
        return removed;
    }

    /**
     * 캐시 통계.
     *
     * @return 현재 스냅샷
     */
    public CacheStatistics statistics() {
        Instant now = clock.instant();
        List<CacheEntry> entries = cacheIndex.entries();
        List<CacheStatistics.EntrySummary> summaries = new ArrayList<>(entries.size());

        int failed = 0;
        int missing = 0;
        long totalBytes = 0;
        Instant oldest = null;
        Instant newest = null;

        for (CacheEntry entry : entries) {
            if (entry.isFailed()) {
                failed++;
            }
            long size = sizeOf(entry);
            if (size < 0) {
                missing++;
            } else {
                totalBytes += size;
            }
            if (oldest == null || entry.createdAt().isBefore(oldest)) {
                oldest = entry.createdAt();
            }
            if (newest == null || entry.createdAt().isAfter(newest)) {
                newest = entry.createdAt();
            }
            summaries.add(new CacheStatistics.EntrySummary(
                entry.key().getValue(),
                entry.producingModel().getValue(),
                entry.status().name(),
                size,
                entry.age(now)
            ));
        }

        return new CacheStatistics(entries.size(), failed, missing, totalBytes,
            hits.get(), misses.get(), oldest, newest, summaries);
    }

    /**
     * 캐시 효율 리포트와 운영 권고.
     *
     * <p>Hit/Miss 수는 감사 로그의 CACHE_HIT/CACHE_MISS 이벤트를 모든 Run에 걸쳐 집계합니다.
     * 감사 로그에 조회 기록이 없거나 읽을 수 없으면 이 프로세스의 카운터를 사용합니다.</p>
     *
     * @return 리포트
     */
    public CacheEfficiencyReport efficiencyReport() {
        Instant now = clock.instant();
        List<CacheEntry> entries = cacheIndex.entries();
        long[] lookups = recordedLookups();
        long hitCount = lookups[0];
        long missCount = lookups[1];
        long total = hitCount + missCount;
        double hitRate = total == 0 ? 0.0 : (double) hitCount / total;
        CacheEfficiency efficiency = CacheEfficiency.classify(hitCount, missCount);

        int stale = 0;
        int failed = 0;
        long totalBytes = 0;
        for (CacheEntry entry : entries) {
            if (entry.age(now).compareTo(STALE_AGE) > 0) {
                stale++;
            }
            if (entry.isFailed()) {
                failed++;
            }
            totalBytes += Math.max(0, sizeOf(entry));
        }
        CacheEfficiencyReport.SizeEfficiency sizeEfficiency = CacheEfficiencyReport.SizeEfficiency.classify(totalBytes);

        List<String> recommendations = new ArrayList<>();
        if (efficiency == CacheEfficiency.NONE) {
            recommendations.add("No cache lookups recorded in the audit log yet");
        } else if (efficiency == CacheEfficiency.LOW) {
            recommendations.add("Hit rate is low; check whether framework, experiment or corpus content changes between runs");
        }
        if (!entries.isEmpty() && (double) stale / entries.size() > STALE_RATIO_THRESHOLD) {
            recommendations.add(String.format("%d of %d entries are older than %d days; consider 'cache --cleanup'",
                stale, entries.size(), STALE_AGE.toDays()));
        }
        if (failed > 0) {
            recommendations.add(String.format("%d failed validation entries cached; run 'cache --cleanup-failed' to retry them", failed));
        }
        if (totalBytes > LARGE_CACHE_BYTES) {
            recommendations.add(String.format("Cache size is large (%d MB); consider 'cache --cleanup' or size limits",
                totalBytes / (1024 * 1024)));
        }
        if (recommendations.isEmpty()) {
            recommendations.add(entries.isEmpty() ? "Cache is empty; no optimization needed" : "Cache is well-optimized");
        }

        return new CacheEfficiencyReport(hitCount, missCount, hitRate, efficiency,
            entries.size(), stale, failed, totalBytes, sizeEfficiency, recommendations);
    }

    /**
     * 감사 로그에 기록된 [hit, miss] 수. 기록이 없으면 이 프로세스의 카운터.
     */
    private long[] recordedLookups() {
        long hitCount = 0;
        long missCount = 0;
        try {
            for (RunId runId : auditLog.runIds()) {
                for (AuditEvent event : auditLog.events(runId)) {
                    if (event.type() == AuditEventType.CACHE_HIT) {
                        hitCount++;
                    } else if (event.type() == AuditEventType.CACHE_MISS) {
                        missCount++;
                    }
                }
            }
        } catch (ArtifactStoreException e) {
            log.warn("Audit log could not be read for cache efficiency, using in-process counters: {}", e.getMessage());
            return new long[] {hits.get(), misses.get()};
        }
        if (hitCount + missCount == 0) {
            return new long[] {hits.get(), misses.get()};
        }
        return new long[] {hitCount, missCount};
    }

    private long sizeOf(CacheEntry entry) {
        try {
            return artifactStore.find(entry.artifactRef()).map(artifact -> (long) artifact.size()).orElse(-1L);
        } catch (ArtifactStoreException e) {
            log.warn("Artifact {} of cache entry {} could not be read: {}", entry.artifactRef(), entry.key(), e.getMessage());
            return -1L;
        }
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    private CacheLookup miss(CacheKey key, CacheLookup.MissReason reason) {
        misses.incrementAndGet();
        log.info("Validation cache miss: {} ({})", key, reason);
        return new CacheLookup.Miss(key, reason);
    }

    private boolean removeUnderLock(CacheEntry expected) {
        synchronized (lockFor(expected.key())) {
            // 정리 중 같은 키가 새로 저장되었으면 건드리지 않음
            Optional<CacheEntry> current = cacheIndex.find(expected.key());
            if (current.isEmpty() || !current.get().equals(expected)) {
                return false;
            }
            return cacheIndex.remove(expected.key());
        }
    }

    Object lockFor(CacheKey key) {
        return keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
    }
}
