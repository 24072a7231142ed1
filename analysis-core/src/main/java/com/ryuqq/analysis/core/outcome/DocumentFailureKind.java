package com.ryuqq.analysis.core.outcome;

/**
 * 문서 분석 실패 분류와 기본 조치 안내.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DocumentFailureKind {

    PROVIDER_EXHAUSTED("Provider kept failing after retries; rerun later or configure a failover model"),

    PROVIDER_REJECTED("Provider rejected the request; check credentials and the document size"),

    CIRCUIT_OPEN("All configured models are unavailable; wait for the cool-down or add a failover model"),

    LOW_CONFIDENCE("Model output could not be parsed reliably; inspect the stored raw response"),

    CANCELLED("Run was cancelled before this document was analyzed"),

    INTERNAL_ERROR("Result could not be stored; check the artifact store and the run log");

    private final String remediation;

    DocumentFailureKind(String remediation) {
        this.remediation = remediation;
    }

    public String remediation() {
        return remediation;
    }
}
