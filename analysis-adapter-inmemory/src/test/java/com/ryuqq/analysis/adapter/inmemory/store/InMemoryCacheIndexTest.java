package com.ryuqq.analysis.adapter.inmemory.store;

import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheEntryStatus;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCacheIndexTest {

    private static final ModelId MODEL = ModelId.of("anthropic/claude");
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryCacheIndex index = new InMemoryCacheIndex();

    private static CacheEntry entry(String seed, Instant createdAt, CacheEntryStatus status) {
        byte[] bytes = seed.getBytes(StandardCharsets.UTF_8);
        return new CacheEntry(CacheKey.derive(bytes, bytes, bytes, MODEL), ContentHash.digest(bytes), MODEL, createdAt, status);
    }

    @Test
    void put_ThenFind_ReturnsEntry() {
        CacheEntry entry = entry("a", T0, CacheEntryStatus.OK);

        index.put(entry);

        assertThat(index.find(entry.key())).contains(entry);
    }

    @Test
    void put_SameKey_ReplacesEntry() {
        CacheEntry failed = entry("a", T0, CacheEntryStatus.FAILED);
        CacheEntry replaced = new CacheEntry(failed.key(), failed.artifactRef(), MODEL, T0.plusSeconds(5), CacheEntryStatus.OK);

        index.put(failed);
        index.put(replaced);

        assertThat(index.entries()).containsExactly(replaced);
    }

    @Test
    void entries_AreOrderedByCreation() {
        CacheEntry late = entry("late", T0.plusSeconds(10), CacheEntryStatus.OK);
        CacheEntry early = entry("early", T0, CacheEntryStatus.OK);

        index.put(late);
        index.put(early);

        assertThat(index.entries()).containsExactly(early, late);
    }

    @Test
    void remove_ReportsWhetherEntryExisted() {
        CacheEntry entry = entry("a", T0, CacheEntryStatus.OK);
        index.put(entry);

        assertThat(index.remove(entry.key())).isTrue();
        assertThat(index.remove(entry.key())).isFalse();
        assertThat(index.find(entry.key())).isEmpty();
    }
}
