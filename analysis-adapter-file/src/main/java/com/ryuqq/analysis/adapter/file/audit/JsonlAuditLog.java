package com.ryuqq.analysis.adapter.file.audit;

import com.ryuqq.analysis.adapter.file.support.FileJson;
import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.spi.AuditLog;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * JSON Lines 파일 기반 {@link AuditLog}.
 *
 * <p>Run마다 {@code <directory>/<runId>.jsonl} 파일 하나에 이벤트를 한 줄씩 추가하고,
 * 추가할 때마다 fsync합니다. {@link #append}가 반환되면 이벤트는 디스크에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonlAuditLog implements AuditLog {

    private static final String SUFFIX = ".jsonl";
    private static final Pattern RUN_ID_FILE_NAME = Pattern.compile("[a-zA-Z0-9\\-_]{1,128}");

    private final Path directory;
    private final Object lock = new Object();

    public JsonlAuditLog(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public void append(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Path file = fileOf(event.runId());
        synchronized (lock) {
            try {
                Files.createDirectories(directory);
                byte[] line = (FileJson.mapper().writeValueAsString(EventLine.from(event)) + "\n")
                    .getBytes(StandardCharsets.UTF_8);
                try (FileChannel channel = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buffer = ByteBuffer.wrap(line);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(false);
                }
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to append audit event to " + file, e);
            }
        }
    }

    @Override
    public List<AuditEvent> events(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        Path file = fileOf(runId);
        List<String> lines;
        synchronized (lock) {
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return List.of();
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to read audit log " + file, e);
            }
        }

        List<AuditEvent> events = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(FileJson.mapper().readValue(line, EventLine.class).toEvent());
            } catch (IOException e) {
                throw new ArtifactStoreException("Corrupt audit line in " + file + ": " + line, e);
            }
        }
        return List.copyOf(events);
    }

    @Override
    public List<RunId> runIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(file -> file.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .filter(id -> RUN_ID_FILE_NAME.matcher(id).matches())
                .map(RunId::of)
                .sorted(Comparator.comparing(RunId::getValue))
                .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list audit logs in " + directory, e);
        }
    }

    private Path fileOf(RunId runId) {
        return directory.resolve(runId.getValue() + SUFFIX);
    }

    /**
     * 파일에 저장되는 한 줄.
     */
    public record EventLine(String runId, String phase, String type, String payloadHash, String detail, Instant timestamp) {

        static EventLine from(AuditEvent event) {
            return new EventLine(
                event.runId().getValue(),
                event.phase().name(),
                event.type().name(),
                event.payloadHash() == null ? null : event.payloadHash().getValue(),
                event.detail(),
                event.timestamp()
            );
        }

        AuditEvent toEvent() {
            return new AuditEvent(
                RunId.of(runId),
                Phase.valueOf(phase),
                AuditEventType.valueOf(type),
                payloadHash == null ? null : ContentHash.of(payloadHash),
                detail,
                timestamp
            );
        }
    }
}
