package com.ryuqq.analysis.adapter.file.audit;

import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonlAuditLogTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final RunId RUN = RunId.of("run-1");

    @TempDir
    Path directory;

    @Test
    void append_WritesOneLinePerEventAndReadsBack() throws IOException {
        // given
        JsonlAuditLog auditLog = new JsonlAuditLog(directory);
        AuditEvent started = new AuditEvent(RUN, Phase.VALIDATION, AuditEventType.RUN_STARTED, null, "3 documents", T0);
        AuditEvent analyzed = new AuditEvent(RUN, Phase.ANALYSIS, AuditEventType.DOCUMENT_ANALYZED,
            ContentHash.digest("record".getBytes(StandardCharsets.UTF_8)), "doc-1", T0.plusSeconds(2));

        // when
        auditLog.append(started);
        auditLog.append(analyzed);

        // then
        List<String> lines = Files.readAllLines(directory.resolve("run-1.jsonl"));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("\"type\":\"RUN_STARTED\"");
        assertThat(new JsonlAuditLog(directory).events(RUN)).containsExactly(started, analyzed);
    }

    @Test
    void events_UnknownRun_ReturnsEmpty() {
        assertThat(new JsonlAuditLog(directory).events(RunId.of("never"))).isEmpty();
    }

    @Test
    void runIds_ListsEveryRunFileAndSkipsOtherFiles() throws IOException {
        // given
        JsonlAuditLog auditLog = new JsonlAuditLog(directory);
        auditLog.append(new AuditEvent(RunId.of("run-b"), Phase.VALIDATION, AuditEventType.CACHE_HIT, null, null, T0));
        auditLog.append(new AuditEvent(RunId.of("run-a"), Phase.VALIDATION, AuditEventType.CACHE_MISS, null, null, T0));
        Files.writeString(directory.resolve("notes.txt"), "operator notes");
        Files.writeString(directory.resolve("not a run.jsonl"), "");

        // when
        List<RunId> runIds = new JsonlAuditLog(directory).runIds();

        // then
        assertThat(runIds).containsExactly(RunId.of("run-a"), RunId.of("run-b"));
    }

    @Test
    void runIds_MissingDirectory_ReturnsEmpty() {
        assertThat(new JsonlAuditLog(directory.resolve("absent")).runIds()).isEmpty();
    }

    @Test
    void events_CorruptLine_Throws() throws IOException {
        JsonlAuditLog auditLog = new JsonlAuditLog(directory);
        auditLog.append(new AuditEvent(RUN, Phase.VALIDATION, AuditEventType.RUN_STARTED, null, null, T0));
        Files.writeString(directory.resolve("run-1.jsonl"), "{broken\n", StandardOpenOption.APPEND);

        assertThatThrownBy(() -> auditLog.events(RUN))
            .isInstanceOf(ArtifactStoreException.class)
            .hasMessageContaining("Corrupt audit line");
    }
}
