package com.ryuqq.analysis.adapter.runner;

import com.ryuqq.analysis.adapter.file.audit.JsonlAuditLog;
import com.ryuqq.analysis.adapter.file.store.FileSystemArtifactStore;
import com.ryuqq.analysis.adapter.file.store.JsonFileCacheIndex;
import com.ryuqq.analysis.application.cache.CoherenceValidation;
import com.ryuqq.analysis.application.cache.ValidationCacheManager;
import com.ryuqq.analysis.core.model.ArtifactFilter;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * CacheCommand 테스트.
 *
 * <p>파일 어댑터로 캐시를 채운 뒤 CLI가 같은 root를 열어 동작하는지 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CacheCommandTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final ModelId MODEL = ModelId.of("anthropic/claude");

    @TempDir
    Path root;

    private Clock clock;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CacheCommand command;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        command = new CacheCommand(new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8), clock);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private String[] args(String... args) {
        String[] withRoot = new String[args.length + 2];
        System.arraycopy(args, 0, withRoot, 0, args.length);
        withRoot[args.length] = "--root";
        withRoot[args.length + 1] = root.toString();
        return withRoot;
    }

    /**
     * T0에 통과 1건과 실패 1건, T0+20h에 통과 1건을 기록합니다.
     */
    private void seed() {
        ValidationCacheManager manager = new ValidationCacheManager(
            new FileSystemArtifactStore(root, FileSystemArtifactStore.DEFAULT_NAMESPACE, clock),
            JsonFileCacheIndex.under(root),
            new JsonlAuditLog(root.resolve("audit")),
            clock);
        manager.storeValidationResult(key(manager, "alpha"), CoherenceValidation.passed("alpha", "ok"), MODEL);
        manager.storeValidationResult(key(manager, "beta"),
            CoherenceValidation.failed("beta", "mismatch", List.of("dimension missing")), MODEL);
        when(clock.instant()).thenReturn(T0.plusSeconds(20 * 3600));
        manager.storeValidationResult(key(manager, "gamma"), CoherenceValidation.passed("gamma", "ok"), MODEL);
    }

    private static CacheKey key(ValidationCacheManager manager, String framework) {
        byte[] bytes = framework.getBytes(StandardCharsets.UTF_8);
        return manager.generateCacheKey(bytes, "experiment".getBytes(StandardCharsets.UTF_8),
            "corpus".getBytes(StandardCharsets.UTF_8), MODEL);
    }

    // ============================================================
    // 1. 실행
    // ============================================================

    @Test
    @DisplayName("--stats는 항목 수와 실패 수를 출력한다")
    void stats_PrintsEntries() {
        seed();

        int code = command.execute(args("--stats"));

        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out()).contains("Entries: 3 (failed: 1, missing artifacts: 0)");
        assertThat(err()).isEmpty();
    }

    @Test
    @DisplayName("--cleanup의 기본 기준은 24시간이다")
    void cleanup_DefaultsTo24Hours() {
        // given
        seed();
        when(clock.instant()).thenReturn(T0.plusSeconds(30 * 3600));

        // when
        int code = command.execute(args("--cleanup"));

        // then
        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out()).contains("Removed 2 entries older than 24 hours");
        assertThat(JsonFileCacheIndex.under(root).entries()).hasSize(1);
    }

    @Test
    void cleanup_WithMaxAge_UsesGivenHours() {
        seed();
        when(clock.instant()).thenReturn(T0.plusSeconds(30 * 3600));

        int code = command.execute(args("--cleanup", "--max-age-hours", "5"));

        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out()).contains("Removed 3 entries older than 5 hours");
    }

    @Test
    @DisplayName("--cleanup-failed는 실패 항목만 제거하고 Artifact는 남긴다")
    void cleanupFailed_RemovesOnlyFailedEntries() {
        seed();

        int code = command.execute(args("--cleanup-failed"));

        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out()).contains("Removed 1 failed validation entries");
        assertThat(JsonFileCacheIndex.under(root).entries()).hasSize(2).noneMatch(CacheEntry::isFailed);
        assertThat(new FileSystemArtifactStore(root, FileSystemArtifactStore.DEFAULT_NAMESPACE, clock)
            .list(ArtifactFilter.all())).hasSize(3);
    }

    @Test
    void efficiency_PrintsRecommendations() {
        seed();

        int code = command.execute(args("--efficiency"));

        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out())
            .contains("Hit rate:")
            .contains("(0 hits, 0 misses)")
            .contains("cache --cleanup-failed");
    }

    @Test
    @DisplayName("--efficiency는 이전 Run들이 감사 로그에 남긴 조회 기록으로 적중률을 계산한다")
    void efficiency_UsesLookupsRecordedByEarlierRuns() {
        // given
        seed();
        JsonlAuditLog audit = new JsonlAuditLog(root.resolve("audit"));
        audit.append(lookup("run-1", AuditEventType.CACHE_MISS));
        audit.append(lookup("run-2", AuditEventType.CACHE_HIT));
        audit.append(lookup("run-2", AuditEventType.CACHE_HIT));
        audit.append(lookup("run-3", AuditEventType.CACHE_HIT));

        // when
        int code = command.execute(args("--efficiency"));

        // then
        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out())
            .contains("(3 hits, 1 misses) - HIGH")
            .contains("Size: ")
            .contains("- GOOD")
            .doesNotContain("No cache lookups recorded");
    }

    private static AuditEvent lookup(String runId, AuditEventType type) {
        return new AuditEvent(RunId.of(runId), Phase.VALIDATION, type, null, "lookup", T0);
    }

    @Test
    void stats_EmptyRoot_PrintsZeroEntries() {
        int code = command.execute(args("--stats"));

        assertThat(code).isEqualTo(CacheCommand.EXIT_OK);
        assertThat(out()).contains("Entries: 0");
    }

    // ============================================================
    // 2. 인자 오류
    // ============================================================

    @Test
    void noArguments_IsUsageError() {
        assertThat(command.execute(new String[0])).isEqualTo(CacheCommand.EXIT_USAGE);
        assertThat(err()).contains("No action given").contains("Usage: cache");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "--stats --cleanup",
        "--stats --max-age-hours 3",
        "--cleanup --max-age-hours -1",
        "--cleanup --max-age-hours soon",
        "--cleanup --max-age-hours",
        "--purge"
    })
    void invalidArguments_AreUsageErrors(String line) {
        int code = command.execute(line.split(" "));

        assertThat(code).isEqualTo(CacheCommand.EXIT_USAGE);
        assertThat(out()).isEmpty();
        assertThat(err()).contains("Usage: cache");
    }

    // ============================================================
    // 3. 실행 실패
    // ============================================================

    @Test
    @DisplayName("root가 파일이면 실행 실패(1)를 반환한다")
    void unusableRoot_IsFailure() throws Exception {
        Path file = Files.writeString(root.resolve("not-a-directory"), "x");

        int code = command.execute(new String[] {"--cleanup-failed", "--root", file.toString()});

        assertThat(code).isEqualTo(CacheCommand.EXIT_FAILURE);
        assertThat(err()).contains("cache command failed");
    }
}
