package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.model.ModelResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseExtractor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResponseExtractorTest {

    private static final ModelId MODEL = ModelId.of("anthropic/claude");

    private final ResponseExtractor extractor = new ResponseExtractor();

    @Test
    @DisplayName("구조화된 페이로드가 있으면 우선 사용")
    void extract_StructuredPayloadFirst() {
        ModelResponse response = new ModelResponse(MODEL, "{\"from\":\"text\"}", "{\"from\":\"tool\"}");

        Extraction extraction = extractor.extract(response);

        assertThat(extraction).isInstanceOf(Extraction.Parsed.class);
        Extraction.Parsed parsed = (Extraction.Parsed) extraction;
        assertThat(parsed.source()).isEqualTo(Extraction.Source.STRUCTURED);
        assertThat(parsed.payload().path("from").asText()).isEqualTo("tool");
    }

    @Test
    @DisplayName("구조화된 페이로드가 객체가 아니면 본문으로 대체")
    void extract_InvalidStructuredPayload_FallsBackToText() {
        ModelResponse response = new ModelResponse(MODEL, "{\"from\":\"text\"}", "[1,2]");

        Extraction.Parsed parsed = (Extraction.Parsed) extractor.extract(response);

        assertThat(parsed.source()).isEqualTo(Extraction.Source.TEXT);
        assertThat(parsed.payload().path("from").asText()).isEqualTo("text");
    }

    @Test
    @DisplayName("코드 펜스 안의 JSON을 꺼낸다")
    void extract_FencedBlock() {
        String text = "Here is my analysis:\n```json\n{\"scores\": {\"tone\": {\"warmth\": 4}},}\n```\nThanks.";

        Extraction.Parsed parsed = (Extraction.Parsed) extractor.extract(ModelResponse.text(MODEL, text));

        assertThat(parsed.source()).isEqualTo(Extraction.Source.EMBEDDED);
        assertThat(parsed.payload().path("scores").path("tone").path("warmth").asInt()).isEqualTo(4);
    }

    @Test
    @DisplayName("펜스가 없으면 첫 여는 중괄호부터 마지막 닫는 중괄호까지 시도")
    void extract_BracesInProse() {
        String text = "Sure! {coherent: true, 'summary': 'fine'} Let me know if you need more.";

        Extraction.Parsed parsed = (Extraction.Parsed) extractor.extract(ModelResponse.text(MODEL, text));

        assertThat(parsed.payload().path("coherent").asBoolean()).isTrue();
        assertThat(parsed.payload().path("summary").asText()).isEqualTo("fine");
    }

    @Test
    @DisplayName("JSON이 없으면 예외 대신 LowConfidence와 원문")
    void extract_NoJson_LowConfidence() {
        String text = "I am not able to score this document.";

        Extraction extraction = extractor.extract(ModelResponse.text(MODEL, text));

        assertThat(extraction.isParsed()).isFalse();
        Extraction.LowConfidence low = (Extraction.LowConfidence) extraction;
        assertThat(low.reason()).isEqualTo("No JSON object found in response");
        assertThat(low.rawResponse()).isEqualTo(text);
    }

    @Test
    void extract_EmptyOrNull_LowConfidence() {
        assertThat(extractor.extract(ModelResponse.text(MODEL, "  "))).isInstanceOf(Extraction.LowConfidence.class);
        assertThat(extractor.extract(null)).isInstanceOf(Extraction.LowConfidence.class);
    }
}
