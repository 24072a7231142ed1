package com.ryuqq.analysis.core.spi;

import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheKey;

import java.util.List;
import java.util.Optional;

/**
 * Validation cache index SPI.
 *
 * <p>Maps cache keys to artifact references. The index holds only metadata; result bodies
 * live in the {@link ArtifactStore}. Only the validation cache manager writes to it.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>{@link #put(CacheEntry)} replaces an existing entry for the same key</li>
 *   <li>Removing an entry never deletes the referenced artifact</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheIndex {

    /**
     * Looks up an entry.
     *
     * @param key the cache key
     * @return the entry, or empty if absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<CacheEntry> find(CacheKey key);

    /**
     * Inserts or replaces an entry.
     *
     * @param entry the entry
     * @throws IllegalArgumentException if entry is null
     */
    void put(CacheEntry entry);

    /**
     * Removes an entry.
     *
     * @param key the cache key
     * @return true if an entry was removed
     * @throws IllegalArgumentException if key is null
     */
    boolean remove(CacheKey key);

    /**
     * Returns a snapshot of all entries.
     *
     * @return all entries, ordered by creation time (oldest first)
     */
    List<CacheEntry> entries();
}
