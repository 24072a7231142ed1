package com.ryuqq.analysis.adapter.inmemory.audit;

import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAuditLogTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryAuditLog auditLog = new InMemoryAuditLog();

    @Test
    void events_ArePartitionedByRunInAppendOrder() {
        RunId first = RunId.of("run-1");
        RunId second = RunId.of("run-2");
        AuditEvent started = new AuditEvent(first, Phase.VALIDATION, AuditEventType.RUN_STARTED, null, null, T0);
        AuditEvent other = new AuditEvent(second, Phase.VALIDATION, AuditEventType.RUN_STARTED, null, null, T0);
        AuditEvent completed = new AuditEvent(first, Phase.VERIFICATION, AuditEventType.RUN_COMPLETED, null, "ok", T0.plusSeconds(1));

        auditLog.append(started);
        auditLog.append(other);
        auditLog.append(completed);

        assertThat(auditLog.events(first)).containsExactly(started, completed);
        assertThat(auditLog.events(second)).containsExactly(other);
        assertThat(auditLog.events(RunId.of("run-3"))).isEmpty();
    }

    @Test
    void runIds_AreSortedByValue() {
        auditLog.append(new AuditEvent(RunId.of("run-2"), Phase.VALIDATION, AuditEventType.CACHE_HIT, null, null, T0));
        auditLog.append(new AuditEvent(RunId.of("run-1"), Phase.VALIDATION, AuditEventType.CACHE_MISS, null, null, T0));

        assertThat(auditLog.runIds()).containsExactly(RunId.of("run-1"), RunId.of("run-2"));
    }

    @Test
    void append_Null_Throws() {
        assertThatThrownBy(() -> auditLog.append(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
