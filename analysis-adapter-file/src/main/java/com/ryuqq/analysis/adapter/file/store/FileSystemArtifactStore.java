package com.ryuqq.analysis.adapter.file.store;

import com.ryuqq.analysis.adapter.file.support.AtomicFiles;
import com.ryuqq.analysis.core.exception.ArtifactNotFoundException;
import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.model.Artifact;
import com.ryuqq.analysis.core.model.ArtifactFilter;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 파일 시스템 기반 {@link ArtifactStore}.
 *
 * <p><strong>디렉토리 구조:</strong></p>
 * <pre>
 * &lt;root&gt;/&lt;namespace&gt;/&lt;해시 앞 2자&gt;/&lt;해시 64자&gt;
 * </pre>
 *
 * <p>쓰기는 임시 파일 + fsync + rename으로 원자적이며, 같은 해시의 파일이 이미 있으면
 * 아무것도 쓰지 않습니다. 생성 시각은 파일 수정 시각으로 기록합니다.</p>
 *
 * <p>읽기 시 내용의 해시를 다시 계산해 파일 이름과 다르면 손상으로 판단하고 파일을 제거한 뒤
 * 없는 것으로 응답합니다. 같은 내용을 다시 put하면 복구됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    public static final String DEFAULT_NAMESPACE = "artifacts";

    private static final Pattern HASH_FILE = Pattern.compile("[0-9a-f]{64}");

    private final Path directory;
    private final Clock clock;

    public FileSystemArtifactStore(Path root) {
        this(root, DEFAULT_NAMESPACE, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param root 저장소 루트
     * @param namespace 하위 디렉토리 이름
     * @param clock 생성 시각 기록용 시계
     * @throws IllegalArgumentException 파라미터가 null이거나 namespace가 비어 있는 경우
     */
    public FileSystemArtifactStore(Path root, String namespace, Clock clock) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (namespace == null || namespace.isBlank() || namespace.contains("/") || namespace.contains("\\")) {
            throw new IllegalArgumentException("namespace must be a single non-blank path segment (current: " + namespace + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.directory = root.resolve(namespace);
        this.clock = clock;
    }

    @Override
    public ContentHash put(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        ContentHash hash = ContentHash.digest(bytes);
        Path target = pathOf(hash);
        if (Files.exists(target)) {
            return hash;
        }
        try {
            AtomicFiles.write(target, bytes, clock.instant());
            log.debug("Artifact stored: {} ({} bytes)", hash, bytes.length);
            return hash;
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write artifact " + hash + " to " + target, e);
        }
    }

    @Override
    public byte[] get(ContentHash hash) {
        return find(hash)
            .map(Artifact::getBytes)
            .orElseThrow(() -> new ArtifactNotFoundException(hash));
    }

    @Override
    public Optional<Artifact> find(ContentHash hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        Path path = pathOf(hash);
        try {
            byte[] bytes = Files.readAllBytes(path);
            Instant createdAt = Files.getLastModifiedTime(path).toInstant();
            Artifact artifact = Artifact.of(bytes, createdAt);
            if (!artifact.getHash().equals(hash)) {
                log.warn("Artifact {} is corrupt (content hash {}), removing it so the next put rewrites it",
                    hash, artifact.getHash());
                Files.deleteIfExists(path);
                return Optional.empty();
            }
            return Optional.of(artifact);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + hash + " from " + path, e);
        }
    }

    @Override
    public boolean exists(ContentHash hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        return Files.isRegularFile(pathOf(hash));
    }

    @Override
    public List<ContentHash> list(ArtifactFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<Listed> listed = new ArrayList<>();
        try (Stream<Path> files = Files.walk(directory, 2)) {
            files.filter(Files::isRegularFile)
                .filter(path -> !AtomicFiles.isTemporary(path))
                .filter(path -> HASH_FILE.matcher(path.getFileName().toString()).matches())
                .forEach(path -> {
                    ContentHash hash = ContentHash.of(path.getFileName().toString());
                    Instant createdAt = lastModified(path);
                    if (filter.matches(hash, createdAt)) {
                        listed.add(new Listed(hash, createdAt));
                    }
                });
        } catch (IOException | UncheckedIOException e) {
            throw new ArtifactStoreException("Failed to list artifacts under " + directory, e);
        }

        return listed.stream()
            .sorted(Comparator.comparing(Listed::createdAt).thenComparing(listedItem -> listedItem.hash().getValue()))
            .limit(filter.limit())
            .map(Listed::hash)
            .toList();
    }

    /**
     * 해시에 해당하는 파일 경로.
     */
    public Path pathOf(ContentHash hash) {
        return directory.resolve(hash.prefix(2)).resolve(hash.getValue());
    }

    public Path getDirectory() {
        return directory;
    }

    private static Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private record Listed(ContentHash hash, Instant createdAt) {
    }
}
