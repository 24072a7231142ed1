package com.ryuqq.analysis.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModelId 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModelIdTest {

    @Test
    void of_ProviderSlashModel_ParsesProvider() {
        ModelId model = ModelId.of("anthropic/claude-sonnet");

        assertEquals("anthropic", model.provider());
        assertEquals("anthropic/claude-sonnet", model.getValue());
    }

    @Test
    void of_WithoutProvider_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("claude"));
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("/claude"));
        assertThrows(IllegalArgumentException.class, () -> ModelId.of("anthropic/"));
        assertThrows(IllegalArgumentException.class, () -> ModelId.of(" "));
    }

    @Test
    void equals_SameValue_AreEqual() {
        assertEquals(ModelId.of("openai/gpt"), ModelId.of("openai/gpt"));
        assertNotEquals(ModelId.of("openai/gpt"), ModelId.of("openai/gpt-mini"));
    }
}
