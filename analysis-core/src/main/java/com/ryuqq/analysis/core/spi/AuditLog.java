package com.ryuqq.analysis.core.spi;

import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.RunId;

import java.util.List;

/**
 * Append-only audit log SPI.
 *
 * <p>Components append an event <em>before</em> the state it describes becomes externally
 * visible (before a registry insert, before a cache entry is written, before the run record
 * is published). Replaying the log therefore enumerates every write a run attempted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AuditLog {

    /**
     * Appends an event. The event is durable when this method returns.
     *
     * @param event the event
     * @throws IllegalArgumentException if event is null
     */
    void append(AuditEvent event);

    /**
     * Returns the events of a run in append order.
     *
     * @param runId the run ID
     * @return events, empty if none
     * @throws IllegalArgumentException if runId is null
     */
    List<AuditEvent> events(RunId runId);

    /**
     * Returns every run that has appended at least one event.
     *
     * <p>Lets operator tooling aggregate events across processes, for example cache hit
     * and miss counts over all recorded runs.</p>
     *
     * @return run IDs ordered by value
     */
    List<RunId> runIds();
}
