package com.ryuqq.analysis.core.exception;

/**
 * Artifact Store 입출력 실패 (디스크 오류 등).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
