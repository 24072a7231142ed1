package com.ryuqq.analysis.adapter.inmemory.store;

import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.spi.CacheIndex;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheIndex} SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCacheIndex implements CacheIndex {

    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> find(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.put(entry.key(), entry);
    }

    @Override
    public boolean remove(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return entries.remove(key) != null;
    }

    @Override
    public List<CacheEntry> entries() {
        return entries.values().stream()
            .sorted(Comparator.comparing(CacheEntry::createdAt))
            .toList();
    }

    /**
     * Removes everything. Test cleanup only.
     */
    public void clear() {
        entries.clear();
    }
}
