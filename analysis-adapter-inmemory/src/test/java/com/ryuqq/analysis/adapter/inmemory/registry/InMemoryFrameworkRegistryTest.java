package com.ryuqq.analysis.adapter.inmemory.registry;

import com.ryuqq.analysis.core.exception.VersionCollisionException;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.FrameworkStatus;
import com.ryuqq.analysis.core.model.FrameworkVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryFrameworkRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryFrameworkRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryFrameworkRegistry registry = new InMemoryFrameworkRegistry();

    private static FrameworkVersion version(String name, int version, String content) {
        return new FrameworkVersion(name, version, ContentHash.digest(content.getBytes(StandardCharsets.UTF_8)),
            FrameworkStatus.ACTIVE, T0);
    }

    @Test
    @DisplayName("버전은 번호 순으로 조회되고 findLatest는 가장 큰 번호")
    void findVersions_SortedByVersion() {
        registry.insert(version("tone", 2, "v2"));
        registry.insert(version("tone", 1, "v1"));

        assertThat(registry.findVersions("tone")).extracting(FrameworkVersion::version).containsExactly(1, 2);
        assertThat(registry.findLatest("tone")).get().extracting(FrameworkVersion::version).isEqualTo(2);
        assertThat(registry.findLatest("unknown")).isEmpty();
    }

    @Test
    @DisplayName("같은 버전 번호 삽입은 VersionCollisionException")
    void insert_DuplicateVersion_Throws() {
        registry.insert(version("tone", 1, "v1"));

        assertThatThrownBy(() -> registry.insert(version("tone", 1, "other")))
            .isInstanceOf(VersionCollisionException.class)
            .satisfies(e -> assertThat(((VersionCollisionException) e).getVersion()).isEqualTo(1));
    }

    @Test
    @DisplayName("같은 내용을 다른 버전으로 삽입하면 VersionCollisionException")
    void insert_DuplicateContent_Throws() {
        registry.insert(version("tone", 1, "v1"));

        assertThatThrownBy(() -> registry.insert(version("tone", 2, "v1")))
            .isInstanceOf(VersionCollisionException.class)
            .hasMessageContaining("already registered as version 1");
    }

    @Test
    void delete_RemovesOnlyThatVersion() {
        registry.insert(version("tone", 1, "v1"));
        registry.insert(version("tone", 2, "v2"));

        assertThat(registry.delete("tone", 2)).isTrue();
        assertThat(registry.delete("tone", 2)).isFalse();
        assertThat(registry.findVersions("tone")).extracting(FrameworkVersion::version).containsExactly(1);
    }

    @Test
    void names_SkipsEmptyFrameworks() {
        registry.insert(version("tone", 1, "v1"));
        registry.insert(version("agency", 1, "a1"));
        registry.delete("agency", 1);
        registry.findVersions("never-registered");

        assertThat(registry.names()).containsExactly("tone");
    }

    @Test
    @DisplayName("동시 삽입 경쟁에서 같은 번호는 하나만 성공한다")
    void insert_ConcurrentSameVersion_ExactlyOneWins() throws InterruptedException {
        // given
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger collisions = new AtomicInteger();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String content = "writer-" + i;
            tasks.add(() -> {
                try {
                    start.await();
                    registry.insert(version("tone", 1, content));
                } catch (VersionCollisionException e) {
                    collisions.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // when
        tasks.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(collisions.get()).isEqualTo(writers - 1);
        assertThat(registry.findVersions("tone")).hasSize(1);
    }
}
