package com.ryuqq.analysis.adapter.file.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ryuqq.analysis.adapter.file.support.AtomicFiles;
import com.ryuqq.analysis.adapter.file.support.FileJson;
import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.model.CacheEntry;
import com.ryuqq.analysis.core.model.CacheEntryStatus;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.spi.CacheIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * JSON 파일 기반 {@link CacheIndex}.
 *
 * <p>인덱스 전체를 파일 하나에 보관하고 변경할 때마다 원자적으로 다시 씁니다.
 * 다른 프로세스(예: cache CLI)가 바꾼 내용을 보도록 조회할 때마다 파일을 읽습니다.</p>
 *
 * <p>파일을 해석할 수 없으면 경고를 남기고 빈 인덱스로 취급합니다.
 * 모든 조회가 Miss가 되고 다음 저장이 파일을 새로 씁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileCacheIndex implements CacheIndex {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCacheIndex.class);

    public static final String DEFAULT_FILE_NAME = "validation_cache_index.json";

    private static final TypeReference<List<IndexRow>> ROWS = new TypeReference<>() {
    };

    private final Path file;
    private final Object lock = new Object();

    /**
     * 생성자.
     *
     * @param file 인덱스 파일 (없으면 첫 저장 시 생성)
     */
    public JsonFileCacheIndex(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        this.file = file;
    }

    /**
     * 저장소 루트 아래 기본 위치 ({@code <root>/cache/validation_cache_index.json}).
     */
    public static JsonFileCacheIndex under(Path root) {
        return new JsonFileCacheIndex(root.resolve("cache").resolve(DEFAULT_FILE_NAME));
    }

    @Override
    public Optional<CacheEntry> find(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        synchronized (lock) {
            return Optional.ofNullable(load().get(key.getValue())).map(IndexRow::toEntry);
        }
    }

    @Override
    public void put(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        synchronized (lock) {
            TreeMap<String, IndexRow> rows = load();
            rows.put(entry.key().getValue(), IndexRow.from(entry));
            save(rows);
        }
    }

    @Override
    public boolean remove(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        synchronized (lock) {
            TreeMap<String, IndexRow> rows = load();
            if (rows.remove(key.getValue()) == null) {
                return false;
            }
            save(rows);
            return true;
        }
    }

    @Override
    public List<CacheEntry> entries() {
        synchronized (lock) {
            return load().values().stream()
                .map(IndexRow::toEntry)
                .sorted(Comparator.comparing(CacheEntry::createdAt).thenComparing(entry -> entry.key().getValue()))
                .toList();
        }
    }

    public Path getFile() {
        return file;
    }

    private TreeMap<String, IndexRow> load() {
        TreeMap<String, IndexRow> rows = new TreeMap<>();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return rows;
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read cache index " + file, e);
        }

        try {
            for (IndexRow row : FileJson.mapper().readValue(bytes, ROWS)) {
                row.toEntry();
                rows.put(row.key(), row);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Cache index {} is unreadable, treating it as empty: {}", file, e.getMessage());
            rows.clear();
        }
        return rows;
    }

    private void save(TreeMap<String, IndexRow> rows) {
        try {
            byte[] bytes = FileJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(new ArrayList<>(rows.values()));
            AtomicFiles.write(file, bytes, null);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write cache index " + file, e);
        }
    }

    /**
     * 파일에 저장되는 행.
     */
    public record IndexRow(String key, String artifactRef, String model, Instant createdAt, String status) {

        static IndexRow from(CacheEntry entry) {
            return new IndexRow(entry.key().getValue(), entry.artifactRef().getValue(),
                entry.producingModel().getValue(), entry.createdAt(), entry.status().name());
        }

        CacheEntry toEntry() {
            return new CacheEntry(CacheKey.of(key), ContentHash.of(artifactRef), ModelId.of(model), createdAt,
                CacheEntryStatus.valueOf(status));
        }
    }
}
