package com.ryuqq.analysis.adapter.file.store;

import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheEntryStatus;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JsonFileCacheIndex 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonFileCacheIndexTest {

    private static final ModelId MODEL = ModelId.of("anthropic/claude");
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path root;

    private static CacheEntry entry(String seed, Instant createdAt, CacheEntryStatus status) {
        byte[] bytes = seed.getBytes(StandardCharsets.UTF_8);
        return new CacheEntry(CacheKey.derive(bytes, bytes, bytes, MODEL), ContentHash.digest(bytes), MODEL, createdAt, status);
    }

    @Test
    void put_PersistsAcrossInstances() {
        // given
        JsonFileCacheIndex index = JsonFileCacheIndex.under(root);
        CacheEntry ok = entry("a", T0, CacheEntryStatus.OK);
        CacheEntry failed = entry("b", T0.plusSeconds(5), CacheEntryStatus.FAILED);

        // when
        index.put(ok);
        index.put(failed);
        JsonFileCacheIndex reopened = JsonFileCacheIndex.under(root);

        // then
        assertThat(index.getFile()).isEqualTo(root.resolve("cache").resolve("validation_cache_index.json"));
        assertThat(reopened.entries()).containsExactly(ok, failed);
        assertThat(reopened.find(failed.key())).contains(failed);
    }

    @Test
    void remove_RewritesFile() {
        JsonFileCacheIndex index = JsonFileCacheIndex.under(root);
        CacheEntry entry = entry("a", T0, CacheEntryStatus.OK);
        index.put(entry);

        assertThat(index.remove(entry.key())).isTrue();
        assertThat(index.remove(entry.key())).isFalse();
        assertThat(JsonFileCacheIndex.under(root).entries()).isEmpty();
    }

    @Test
    void load_UnreadableFile_IsTreatedAsEmptyAndRecovers() throws IOException {
        // given
        JsonFileCacheIndex index = JsonFileCacheIndex.under(root);
        Files.createDirectories(index.getFile().getParent());
        Files.writeString(index.getFile(), "{ this is not the index");

        // when & then
        assertThat(index.entries()).isEmpty();

        CacheEntry entry = entry("a", T0, CacheEntryStatus.OK);
        index.put(entry);
        assertThat(index.find(entry.key())).contains(entry);
    }

    @Test
    void load_RowWithInvalidKey_IsTreatedAsEmpty() throws IOException {
        JsonFileCacheIndex index = JsonFileCacheIndex.under(root);
        Files.createDirectories(index.getFile().getParent());
        Files.writeString(index.getFile(),
            "[{\"key\":\"bogus\",\"artifactRef\":\"x\",\"model\":\"a/b\",\"createdAt\":\"2026-01-01T00:00:00Z\",\"status\":\"OK\"}]");

        assertThat(index.entries()).isEmpty();
    }

    @Test
    void find_MissingFile_ReturnsEmpty() {
        JsonFileCacheIndex index = JsonFileCacheIndex.under(root);

        assertThat(index.find(entry("a", T0, CacheEntryStatus.OK).key())).isEmpty();
        assertThat(index.getFile()).doesNotExist();
    }
}
