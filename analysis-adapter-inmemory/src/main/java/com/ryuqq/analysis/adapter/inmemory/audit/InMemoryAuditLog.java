package com.ryuqq.analysis.adapter.inmemory.audit;

import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.spi.AuditLog;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link AuditLog} SPI.
 *
 * <p>Events of each run are kept in a {@link CopyOnWriteArrayList}, preserving append order
 * across concurrent analysis workers.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAuditLog implements AuditLog {

    private final ConcurrentHashMap<RunId, CopyOnWriteArrayList<AuditEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void append(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.computeIfAbsent(event.runId(), key -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<AuditEvent> events(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        List<AuditEvent> runEvents = events.get(runId);
        return runEvents == null ? List.of() : List.copyOf(runEvents);
    }

    @Override
    public List<RunId> runIds() {
        return events.keySet().stream()
            .sorted(Comparator.comparing(RunId::getValue))
            .toList();
    }

    /**
     * Removes everything. Test cleanup only.
     */
    public void clear() {
        events.clear();
    }
}
