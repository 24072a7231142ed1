package com.ryuqq.analysis.core.outcome;

import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.ModelId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DocumentOutcome 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DocumentOutcomeTest {

    private static final ContentHash REF = ContentHash.digest("artifact".getBytes(StandardCharsets.UTF_8));

    @Test
    void analyzed_CopiesScores() {
        // Given
        Map<String, Double> scores = new HashMap<>();
        scores.put("tone.warmth", 0.4);

        // When
        Analyzed analyzed = new Analyzed("doc-1", REF, ModelId.of("anthropic/claude"), scores);
        scores.put("tone.warmth", 0.9);

        // Then
        assertEquals(0.4, analyzed.scores().get("tone.warmth"));
        assertTrue(analyzed.isAnalyzed());
        assertFalse(analyzed.isFailed());
        assertThrows(UnsupportedOperationException.class, () -> analyzed.scores().put("x", 1.0));
    }

    @Test
    void failed_WithoutRawResponse_IsAllowed() {
        Failed failed = Failed.of("doc-2", DocumentFailureKind.PROVIDER_REJECTED, "401 Unauthorized");

        assertNull(failed.rawResponseRef());
        assertTrue(failed.isFailed());
        assertEquals("doc-2", failed.documentName());
    }

    @Test
    void failed_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> Failed.of("doc-2", DocumentFailureKind.CANCELLED, " "));
    }

    @Test
    void patternMatch_DistinguishesVariants() {
        DocumentOutcome outcome = Failed.of("doc-3", DocumentFailureKind.LOW_CONFIDENCE, "no JSON");

        String label;
        if (outcome instanceof Analyzed analyzed) {
            label = "analyzed " + analyzed.documentName();
        } else if (outcome instanceof Failed failed) {
            label = failed.kind() + " " + failed.documentName();
        } else {
            throw new AssertionError("unexpected outcome " + outcome);
        }

        assertEquals("LOW_CONFIDENCE doc-3", label);
    }
}
