package com.ryuqq.analysis.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContentHash 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ContentHashTest {

    @Test
    void digest_KnownInput_ReturnsSha256Hex() {
        // When
        ContentHash hash = ContentHash.digest("abc".getBytes(StandardCharsets.UTF_8));

        // Then
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hash.getValue());
    }

    @Test
    void digest_EmptyInput_IsAllowed() {
        ContentHash hash = ContentHash.digest(new byte[0]);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", hash.getValue());
    }

    @Test
    void of_UppercaseOrShortValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> ContentHash.of("BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD"));
        assertThrows(IllegalArgumentException.class, () -> ContentHash.of("ba7816bf"));
    }

    @Test
    void prefix_ReturnsLeadingCharacters() {
        ContentHash hash = ContentHash.digest("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals("ba", hash.prefix(2));
        assertThrows(IllegalArgumentException.class, () -> hash.prefix(0));
        assertThrows(IllegalArgumentException.class, () -> hash.prefix(65));
    }
}
