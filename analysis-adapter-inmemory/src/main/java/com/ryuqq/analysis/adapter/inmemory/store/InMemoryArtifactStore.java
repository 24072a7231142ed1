package com.ryuqq.analysis.adapter.inmemory.store;

import com.ryuqq.analysis.core.exception.ArtifactNotFoundException;
import com.ryuqq.analysis.core.model.Artifact;
import com.ryuqq.analysis.core.model.ArtifactFilter;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.spi.ArtifactStore;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ArtifactStore} SPI for testing and reference purposes.
 *
 * <p>Artifacts are kept in a {@link ConcurrentHashMap} keyed by content hash.
 * {@link ConcurrentHashMap#putIfAbsent(Object, Object)} guarantees that concurrent puts of
 * identical bytes converge to a single stored copy.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<ContentHash, Artifact> artifacts = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();
    private final Clock clock;

    /**
     * Creates a store using the system UTC clock.
     */
    public InMemoryArtifactStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store using the given clock for creation timestamps.
     *
     * @param clock the clock
     */
    public InMemoryArtifactStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public ContentHash put(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        Artifact artifact = Artifact.of(bytes, clock.instant());
        if (artifacts.putIfAbsent(artifact.getHash(), artifact) == null) {
            writes.incrementAndGet();
        }
        return artifact.getHash();
    }

    @Override
    public byte[] get(ContentHash hash) {
        return find(hash)
            .map(Artifact::getBytes)
            .orElseThrow(() -> new ArtifactNotFoundException(hash));
    }

    @Override
    public Optional<Artifact> find(ContentHash hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        return Optional.ofNullable(artifacts.get(hash));
    }

    @Override
    public boolean exists(ContentHash hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        return artifacts.containsKey(hash);
    }

    @Override
    public List<ContentHash> list(ArtifactFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        return artifacts.values().stream()
            .filter(artifact -> filter.matches(artifact.getHash(), artifact.getCreatedAt()))
            .sorted(Comparator.comparing(Artifact::getCreatedAt)
                .thenComparing(artifact -> artifact.getHash().getValue()))
            .limit(filter.limit())
            .map(Artifact::getHash)
            .toList();
    }

    /**
     * Number of distinct artifacts stored.
     *
     * @return artifact count
     */
    public int size() {
        return artifacts.size();
    }

    /**
     * Number of physical writes performed (duplicates are not counted).
     *
     * @return write count
     */
    public long writeCount() {
        return writes.get();
    }

    /**
     * Removes everything. Test cleanup only.
     */
    public void clear() {
        artifacts.clear();
        writes.set(0);
    }
}
