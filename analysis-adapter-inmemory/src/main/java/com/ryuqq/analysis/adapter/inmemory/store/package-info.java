/**
 * In-memory storage adapters.
 *
 * <p>Thread-safe {@link com.ryuqq.analysis.core.spi.ArtifactStore} and
 * {@link com.ryuqq.analysis.core.spi.CacheIndex} implementations backed by
 * {@link java.util.concurrent.ConcurrentHashMap}, for tests and single-process use.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.adapter.inmemory.store;
