package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.analysis.application.cache.CoherenceValidation;
import com.ryuqq.analysis.application.support.JsonCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CoherenceValidatorTest {

    @Test
    void toValidation_Coherent_Passes() {
        ObjectNode payload = JsonCodec.canonical().createObjectNode();
        payload.put("coherent", true).put("summary", "fits the corpus");
        payload.putArray("issues").add("minor: overlapping descriptions");

        CoherenceValidation validation = CoherenceValidator.toValidation("tone",
            new Extraction.Parsed(payload, Extraction.Source.STRUCTURED));

        assertThat(validation.success()).isTrue();
        assertThat(validation.summary()).isEqualTo("fits the corpus");
        assertThat(validation.issues()).containsExactly("minor: overlapping descriptions");
    }

    @Test
    void toValidation_Incoherent_Fails() {
        ObjectNode payload = JsonCodec.canonical().createObjectNode();
        payload.put("coherent", false).put("summary", "dimensions do not apply to speeches");

        CoherenceValidation validation = CoherenceValidator.toValidation("tone",
            new Extraction.Parsed(payload, Extraction.Source.TEXT));

        assertThat(validation.success()).isFalse();
        assertThat(validation.frameworkName()).isEqualTo("tone");
    }

    @Test
    void toValidation_MissingFlag_Fails() {
        ObjectNode payload = JsonCodec.canonical().createObjectNode().put("coherent", "yes");

        CoherenceValidation validation = CoherenceValidator.toValidation("tone",
            new Extraction.Parsed(payload, Extraction.Source.TEXT));

        assertThat(validation.success()).isFalse();
        assertThat(validation.issues()).containsExactly("missing field: coherent");
    }

    @Test
    void toValidation_LowConfidence_FailsWithReason() {
        CoherenceValidation validation = CoherenceValidator.toValidation("tone",
            new Extraction.LowConfidence("No JSON object found in response", "sorry"));

        assertThat(validation.success()).isFalse();
        assertThat(validation.issues()).containsExactly("No JSON object found in response");
    }
}
