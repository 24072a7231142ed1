package com.ryuqq.analysis.core.outcome;

import com.ryuqq.analysis.core.model.ContentHash;

/**
 * 분석 실패 (기록 후 격리).
 *
 * @param documentName 문서 이름
 * @param kind 실패 분류
 * @param message 실패 메시지 (스택 트레이스가 아닌 요약)
 * @param rawResponseRef 낮은 신뢰도 응답 원문 해시 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(
    String documentName,
    DocumentFailureKind kind,
    String message,
    ContentHash rawResponseRef
) implements DocumentOutcome {

    public Failed {
        if (documentName == null || documentName.isBlank()) {
            throw new IllegalArgumentException("documentName cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // rawResponseRef는 null 허용
    }

    public static Failed of(String documentName, DocumentFailureKind kind, String message) {
        return new Failed(documentName, kind, message, null);
    }
}
