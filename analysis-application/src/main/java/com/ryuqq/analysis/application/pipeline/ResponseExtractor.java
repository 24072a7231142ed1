package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.core.model.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 모델 응답 추출기.
 *
 * <p>구조화 payload를 우선 사용하고, 없으면 본문에서 관대한 JSON 파싱
 * (trailing comma, 주석, 작은따옴표 허용)을 시도합니다. 어떤 경우에도
 * 예외를 던지지 않습니다.</p>
 *
 * <pre>
 * 1. structuredPayload → STRUCTURED
 * 2. 본문 전체         → TEXT
 * 3. ```json 코드 블록 → EMBEDDED
 * 4. 첫 '{' ~ 마지막 '}' → EMBEDDED
 * 5. 모두 실패         → LowConfidence
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResponseExtractor.class);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    /**
     * 응답에서 JSON 객체 추출.
     *
     * @param response 모델 응답
     * @return Parsed 또는 LowConfidence
     */
    public Extraction extract(ModelResponse response) {
        if (response == null) {
            return new Extraction.LowConfidence("No response", "");
        }

        if (response.hasStructuredPayload()) {
            Optional<JsonNode> structured = parseObject(response.structuredPayload());
            if (structured.isPresent()) {
                return new Extraction.Parsed(structured.get(), Extraction.Source.STRUCTURED);
            }
            log.warn("Structured payload from {} is not a JSON object, falling back to text", response.model());
        }

        String text = response.text();
        if (text == null || text.isBlank()) {
            return new Extraction.LowConfidence("Empty response text", response.structuredPayload());
        }

        Optional<JsonNode> whole = parseObject(text.strip());
        if (whole.isPresent()) {
            return new Extraction.Parsed(whole.get(), Extraction.Source.TEXT);
        }

        Matcher fenced = FENCED_BLOCK.matcher(text);
        while (fenced.find()) {
            Optional<JsonNode> block = parseObject(fenced.group(1).strip());
            if (block.isPresent()) {
                return new Extraction.Parsed(block.get(), Extraction.Source.EMBEDDED);
            }
        }

        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            Optional<JsonNode> braces = parseObject(text.substring(open, close + 1));
            if (braces.isPresent()) {
                return new Extraction.Parsed(braces.get(), Extraction.Source.EMBEDDED);
            }
        }

        return new Extraction.LowConfidence("No JSON object found in response", text);
    }

    private static Optional<JsonNode> parseObject(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = JsonCodec.lenient().readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
