package com.ryuqq.analysis.adapter.inmemory.registry;

import com.ryuqq.analysis.core.exception.VersionCollisionException;
import com.ryuqq.analysis.core.model.FrameworkVersion;
import com.ryuqq.analysis.core.spi.FrameworkRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link FrameworkRegistry} SPI.
 *
 * <p>Simulates the unique constraints of a relational registry table:
 * {@code (name, version)} and {@code (name, content_hash)}. Each framework name has its own
 * monitor, so inserts for different names do not contend.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryFrameworkRegistry implements FrameworkRegistry {

    private final ConcurrentHashMap<String, NavigableMap<Integer, FrameworkVersion>> rows = new ConcurrentHashMap<>();

    @Override
    public List<FrameworkVersion> findVersions(String name) {
        NavigableMap<Integer, FrameworkVersion> versions = versionsOf(name);
        synchronized (versions) {
            return List.copyOf(versions.values());
        }
    }

    @Override
    public Optional<FrameworkVersion> findLatest(String name) {
        NavigableMap<Integer, FrameworkVersion> versions = versionsOf(name);
        synchronized (versions) {
            Map.Entry<Integer, FrameworkVersion> last = versions.lastEntry();
            return last == null ? Optional.empty() : Optional.of(last.getValue());
        }
    }

    @Override
    public void insert(FrameworkVersion version) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        NavigableMap<Integer, FrameworkVersion> versions = versionsOf(version.name());
        synchronized (versions) {
            if (versions.containsKey(version.version())) {
                throw new VersionCollisionException(version.name(), version.version(),
                    "Version " + version.version() + " of '" + version.name() + "' already exists");
            }
            for (FrameworkVersion existing : versions.values()) {
                if (existing.contentHash().equals(version.contentHash())) {
                    throw new VersionCollisionException(version.name(), version.version(),
                        "Content of '" + version.name() + "' is already registered as version " + existing.version());
                }
            }
            versions.put(version.version(), version);
        }
    }

    @Override
    public boolean delete(String name, int version) {
        NavigableMap<Integer, FrameworkVersion> versions = versionsOf(name);
        synchronized (versions) {
            return versions.remove(version) != null;
        }
    }

    @Override
    public List<String> names() {
        List<String> names = new ArrayList<>();
        rows.forEach((name, versions) -> {
            synchronized (versions) {
                if (!versions.isEmpty()) {
                    names.add(name);
                }
            }
        });
        names.sort(null);
        return names;
    }

    /**
     * Removes everything. Test cleanup only.
     */
    public void clear() {
        rows.clear();
    }

    private NavigableMap<Integer, FrameworkVersion> versionsOf(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return rows.computeIfAbsent(name, key -> new TreeMap<>());
    }
}
