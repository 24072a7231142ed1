/**
 * In-memory framework registry adapter.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.adapter.inmemory.registry;
