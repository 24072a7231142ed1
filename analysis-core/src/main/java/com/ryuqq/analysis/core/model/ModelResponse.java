package com.ryuqq.analysis.core.model;

/**
 * 모델 호출 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param model 실제로 응답한 모델 (Failover 시 요청 모델과 다를 수 있음)
 * @param text 자유 텍스트 응답 (없으면 빈 문자열)
 * @param structuredPayload Tool 호출로 받은 JSON (없으면 null)
 */
public record ModelResponse(
    ModelId model,
    String text,
    String structuredPayload
) {

    public ModelResponse {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        text = text == null ? "" : text;
    }

    public static ModelResponse text(ModelId model, String text) {
        return new ModelResponse(model, text, null);
    }

    public static ModelResponse structured(ModelId model, String json) {
        return new ModelResponse(model, "", json);
    }

    public boolean hasStructuredPayload() {
        return structuredPayload != null && !structuredPayload.isBlank();
    }
}
