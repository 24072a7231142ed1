package com.ryuqq.analysis.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RollbackGuidance 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RollbackGuidanceTest {

    @Test
    void render_ListsEachFailureWithRemediationAndRevertedVersions() {
        // Given
        FrameworkVersion reverted = new FrameworkVersion("gamma", 2,
            ContentHash.digest("g".getBytes(StandardCharsets.UTF_8)), FrameworkStatus.DRAFT, Instant.EPOCH);
        RollbackGuidance guidance = new RollbackGuidance(List.of(
            RollbackGuidance.FailedFramework.of("delta", FrameworkFailureKind.MISSING_REGISTRY, "not registered"),
            RollbackGuidance.FailedFramework.of("epsilon", FrameworkFailureKind.MALFORMED, "not json")
        ), List.of(reverted));

        // When
        String rendered = guidance.render();

        // Then
        assertEquals(List.of("delta", "epsilon"), guidance.failedFrameworkNames());
        assertTrue(rendered.startsWith("Framework transaction failed: 2 framework(s)"));
        assertTrue(rendered.contains("- delta [MISSING_REGISTRY] not registered"));
        assertTrue(rendered.contains(FrameworkFailureKind.MALFORMED.remediation()));
        assertTrue(rendered.contains("Reverted versions: gamma v2"));
    }

    @Test
    void constructor_WithoutFailures_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RollbackGuidance(List.of(), List.of()));
    }

    @Test
    void failedFramework_WithoutRemediation_UsesKindDefault() {
        RollbackGuidance.FailedFramework failure =
            new RollbackGuidance.FailedFramework("alpha", FrameworkFailureKind.VERSION_MISMATCH, "v3 missing", null);

        assertEquals(FrameworkFailureKind.VERSION_MISMATCH.remediation(), failure.remediation());
    }
}
