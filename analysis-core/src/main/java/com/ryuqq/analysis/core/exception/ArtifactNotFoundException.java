package com.ryuqq.analysis.core.exception;

import com.ryuqq.analysis.core.model.ContentHash;

/**
 * 요청한 해시의 Artifact가 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ArtifactNotFoundException extends RuntimeException {

    private final ContentHash hash;

    public ArtifactNotFoundException(ContentHash hash) {
        super("Artifact not found: " + (hash == null ? null : hash.getValue()));
        this.hash = hash;
    }

    public ContentHash getHash() {
        return hash;
    }
}
