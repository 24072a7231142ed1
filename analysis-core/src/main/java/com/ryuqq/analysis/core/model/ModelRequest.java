package com.ryuqq.analysis.core.model;

import java.time.Duration;

/**
 * 모델 호출 요청.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param model 호출할 모델
 * @param prompt 프롬프트 본문
 * @param toolSchema 구조화 출력용 JSON Schema (없으면 null, 자유 텍스트 응답)
 * @param deadline 호출 한 번의 최대 허용 시간
 */
public record ModelRequest(
    ModelId model,
    String prompt,
    String toolSchema,
    Duration deadline
) {

    public ModelRequest {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be positive (current: " + deadline + ")");
        }
    }

    /**
     * 모델만 바꾼 새 요청 (Failover용).
     */
    public ModelRequest withModel(ModelId model) {
        return new ModelRequest(model, prompt, toolSchema, deadline);
    }

    public boolean hasToolSchema() {
        return toolSchema != null && !toolSchema.isBlank();
    }
}
