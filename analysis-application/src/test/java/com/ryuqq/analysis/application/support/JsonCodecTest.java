package com.ryuqq.analysis.application.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.cache.CoherenceValidation;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {

    @Test
    void write_SortsMapKeysForStableHashes() {
        Map<String, Integer> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Integer> second = new LinkedHashMap<>();
        second.put("a", 1);
        second.put("b", 2);

        assertThat(JsonCodec.write(first)).isEqualTo(JsonCodec.write(second));
        assertThat(new String(JsonCodec.write(first), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1,\"b\":2}");
    }

    @Test
    void readWrite_Record() {
        CoherenceValidation validation = CoherenceValidation.failed("tone", "overlap", List.of("warmth vs empathy"));

        CoherenceValidation read = JsonCodec.read(JsonCodec.write(validation), CoherenceValidation.class);

        assertThat(read).isEqualTo(validation);
    }

    @Test
    void read_Invalid_ThrowsUnchecked() {
        assertThatThrownBy(() -> JsonCodec.readTree("{oops".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void lenient_AcceptsModelStyleJson() throws Exception {
        JsonNode node = JsonCodec.lenient().readTree("{scores: {'tone': 3,}, // trailing\n}");

        assertThat(node.path("scores").path("tone").asInt()).isEqualTo(3);
    }
}
