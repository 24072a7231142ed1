/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide storage and model access to the analysis pipeline.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.analysis.core.spi.ArtifactStore} - Content-addressed blob storage</li>
 *   <li>{@link com.ryuqq.analysis.core.spi.CacheIndex} - Validation cache index</li>
 *   <li>{@link com.ryuqq.analysis.core.spi.FrameworkRegistry} - Framework version rows</li>
 *   <li>{@link com.ryuqq.analysis.core.spi.AuditLog} - Append-only audit trail</li>
 *   <li>{@link com.ryuqq.analysis.core.spi.ModelGateway} - Model provider calls</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (analysis-adapter-inmemory, analysis-adapter-file) provide concrete
 * implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.spi;
