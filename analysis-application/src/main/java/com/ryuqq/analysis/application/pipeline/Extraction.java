package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 모델 응답에서 구조화 데이터를 추출한 결과.
 *
 * <p>파싱 실패는 예외가 아니라 {@link LowConfidence}로 표현됩니다.
 * 호출자는 원문을 Artifact로 보관하고 문서를 실패로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Extraction {

    default boolean isParsed() {
        return this instanceof Parsed;
    }

    /**
     * 추출 성공.
     *
     * @param payload JSON 객체
     * @param source 추출 경로
     */
    record Parsed(JsonNode payload, Source source) implements Extraction {

        public Parsed {
            if (payload == null || !payload.isObject()) {
                throw new IllegalArgumentException("payload must be a JSON object");
            }
            if (source == null) {
                throw new IllegalArgumentException("source cannot be null");
            }
        }
    }

    /**
     * 신뢰할 수 있는 구조를 찾지 못함.
     *
     * @param reason 원인
     * @param rawResponse 응답 원문
     */
    record LowConfidence(String reason, String rawResponse) implements Extraction {

        public LowConfidence {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
            rawResponse = rawResponse == null ? "" : rawResponse;
        }
    }

    /**
     * 추출 경로 (신뢰도 높은 순).
     */
    enum Source {

        /** Tool 호출의 구조화 payload. */
        STRUCTURED,

        /** 응답 본문 전체가 JSON. */
        TEXT,

        /** 본문 안의 코드 블록 또는 중괄호 구간. */
        EMBEDDED
    }
}
