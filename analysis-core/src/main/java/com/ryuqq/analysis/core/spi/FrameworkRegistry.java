package com.ryuqq.analysis.core.spi;

import com.ryuqq.analysis.core.model.FrameworkVersion;

import java.util.List;
import java.util.Optional;

/**
 * Framework version registry SPI (the single source of truth for framework definitions).
 *
 * <p>Typically backed by a relational table
 * {@code framework_versions(name, version, content_hash, status, created_at)} with unique
 * constraints on {@code (name, version)} and {@code (name, content_hash)}.</p>
 *
 * <p><strong>Optimistic Insert:</strong></p>
 * <pre>
 * INSERT INTO framework_versions (name, version, content_hash, status, created_at)
 * VALUES (?, ?, ?, ?, ?);
 * -- unique violation → VersionCollisionException, caller retries with the next number
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe and consistent under concurrent inserts for the same name</li>
 *   <li>Existing rows are never modified</li>
 *   <li>{@link #delete(String, int)} is reserved for transaction rollback of rows the
 *       same transaction created</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FrameworkRegistry {

    /**
     * Returns all versions of a framework.
     *
     * @param name the framework name
     * @return versions ordered by version number ascending; empty if unknown
     * @throws IllegalArgumentException if name is null
     */
    List<FrameworkVersion> findVersions(String name);

    /**
     * Returns the highest version of a framework.
     *
     * @param name the framework name
     * @return the latest version, or empty if unknown
     * @throws IllegalArgumentException if name is null
     */
    Optional<FrameworkVersion> findLatest(String name);

    /**
     * Inserts a new version row.
     *
     * @param version the row to insert
     * @throws IllegalArgumentException if version is null
     * @throws com.ryuqq.analysis.core.exception.VersionCollisionException if the
     *         {@code (name, version)} or {@code (name, contentHash)} pair already exists
     */
    void insert(FrameworkVersion version);

    /**
     * Deletes a version row (rollback only).
     *
     * @param name the framework name
     * @param version the version number
     * @return true if a row was deleted
     * @throws IllegalArgumentException if name is null
     */
    boolean delete(String name, int version);

    /**
     * Returns all registered framework names.
     *
     * @return names in ascending order
     */
    List<String> names();
}
