package com.ryuqq.analysis.core.spi;

import com.ryuqq.analysis.core.model.Artifact;
import com.ryuqq.analysis.core.model.ArtifactFilter;
import com.ryuqq.analysis.core.model.ContentHash;

import java.util.List;
import java.util.Optional;

/**
 * Content-addressed, append-only blob storage SPI.
 *
 * <p>Every persisted result in the pipeline (validation results, per-document analyses,
 * synthesis and verification reports, run records, framework definitions) is stored here
 * and referenced by its SHA-256 hash.</p>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>The returned hash is a pure function of the bytes</li>
 *   <li>Putting identical bytes twice never writes a second copy</li>
 *   <li>No update or delete operation exists; stored bytes never change</li>
 *   <li>{@link #put(byte[])} returns only after the write is durable</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> Reads require no locking because artifacts are immutable.
 * Concurrent puts of the same bytes must converge to a single stored copy.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Stores bytes and returns their content hash.
     *
     * <p><strong>Idempotency:</strong> If an artifact with the same hash already exists,
     * nothing is written and the existing hash is returned.</p>
     *
     * @param bytes the content to store
     * @return the SHA-256 content hash
     * @throws IllegalArgumentException if bytes is null
     * @throws com.ryuqq.analysis.core.exception.ArtifactStoreException if the write fails
     */
    ContentHash put(byte[] bytes);

    /**
     * Retrieves the bytes stored under a hash.
     *
     * @param hash the content hash
     * @return a copy of the stored bytes
     * @throws IllegalArgumentException if hash is null
     * @throws com.ryuqq.analysis.core.exception.ArtifactNotFoundException if no artifact exists
     */
    byte[] get(ContentHash hash);

    /**
     * Retrieves the artifact including its creation time.
     *
     * @param hash the content hash
     * @return the artifact, or empty if absent
     * @throws IllegalArgumentException if hash is null
     */
    Optional<Artifact> find(ContentHash hash);

    /**
     * Checks whether an artifact exists.
     *
     * @param hash the content hash
     * @return true if stored
     * @throws IllegalArgumentException if hash is null
     */
    boolean exists(ContentHash hash);

    /**
     * Lists hashes matching the filter, ordered by creation time (oldest first).
     *
     * @param filter the filter
     * @return matching hashes, at most {@code filter.limit()} entries
     * @throws IllegalArgumentException if filter is null
     */
    List<ContentHash> list(ArtifactFilter filter);
}
