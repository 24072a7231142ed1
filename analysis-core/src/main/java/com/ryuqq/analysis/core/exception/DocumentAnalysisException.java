package com.ryuqq.analysis.core.exception;

/**
 * 문서 하나의 분석 실패.
 *
 * <p>Run 전체를 중단하지 않고 기록만 하며, 실패율 임계값 계산에 포함됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DocumentAnalysisException extends RuntimeException {

    private final String documentName;

    public DocumentAnalysisException(String documentName, String message, Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }
}
