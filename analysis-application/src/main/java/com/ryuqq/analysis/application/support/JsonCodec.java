package com.ryuqq.analysis.application.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Artifact 직렬화용 JSON 코덱.
 *
 * <p>Artifact는 내용 해시로 식별되므로 같은 값은 언제나 같은 바이트로
 * 직렬화되어야 합니다. 속성과 Map 키를 정렬하고 시각은 ISO-8601 문자열로 씁니다.</p>
 *
 * <p>{@link #lenient()}는 모델 응답처럼 trailing comma, 주석, 작은따옴표가 섞인
 * JSON을 읽을 때만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonCodec {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private static final ObjectMapper LENIENT = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private JsonCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값을 정규화된 JSON 바이트로 직렬화.
     *
     * @param value 직렬화할 값
     * @return UTF-8 JSON
     * @throws UncheckedIOException 직렬화 실패 시
     */
    public static byte[] write(Object value) {
        try {
            return CANONICAL.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * JSON 바이트를 지정한 타입으로 역직렬화.
     *
     * @param bytes UTF-8 JSON
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 역직렬화된 값
     * @throws UncheckedIOException 형식이 잘못된 경우
     */
    public static <T> T read(byte[] bytes, Class<T> type) {
        try {
            return CANONICAL.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * JSON 바이트를 트리로 읽기.
     *
     * @param bytes UTF-8 JSON
     * @return 트리
     * @throws UncheckedIOException 형식이 잘못된 경우
     */
    public static JsonNode readTree(byte[] bytes) {
        try {
            return CANONICAL.readTree(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse JSON", e);
        }
    }

    /**
     * 정규화 매퍼 (정렬된 출력, 엄격한 입력).
     */
    public static ObjectMapper canonical() {
        return CANONICAL;
    }

    /**
     * 관대한 매퍼 (모델 응답 파싱 전용).
     */
    public static ObjectMapper lenient() {
        return LENIENT;
    }
}
