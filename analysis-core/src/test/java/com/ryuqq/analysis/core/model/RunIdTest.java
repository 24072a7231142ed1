package com.ryuqq.analysis.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunIdTest {

    @Test
    void of_AllowedCharacters_Succeeds() {
        assertEquals("run_2026-01-01", RunId.of("run_2026-01-01").getValue());
    }

    @Test
    void of_InvalidCharactersOrLength_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RunId.of("run 1"));
        assertThrows(IllegalArgumentException.class, () -> RunId.of("run/1"));
        assertThrows(IllegalArgumentException.class, () -> RunId.of("a".repeat(129)));
        assertDoesNotThrow(() -> RunId.of("a".repeat(128)));
    }

    @Test
    void generate_ProducesDistinctIds() {
        assertNotEquals(RunId.generate(), RunId.generate());
    }
}
