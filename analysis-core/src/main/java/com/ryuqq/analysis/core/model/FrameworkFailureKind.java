package com.ryuqq.analysis.core.model;

/**
 * 프레임워크 검증 실패 분류와 기본 조치 안내.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FrameworkFailureKind {

    MISSING_REGISTRY("Import the framework into the registry before running the experiment"),

    UNREADABLE_LOCAL_COPY("Check that the local framework file exists and is readable"),

    MALFORMED("Fix the framework definition; it must be valid JSON with a non-empty 'dimensions' list"),

    VERSION_MISMATCH("Update the experiment to a registered framework version or restore the local copy to the pinned version"),

    VERSION_COLLISION("Another writer is registering versions of this framework; retry the run once it finishes"),

    CONTENT_MISMATCH_UNRESOLVED("Resolve the local changes manually and import the framework as a new version"),

    VALIDATION_ABORTED("Check that the framework registry and artifact store are reachable, then rerun the experiment");

    private final String remediation;

    FrameworkFailureKind(String remediation) {
        this.remediation = remediation;
    }

    /**
     * 운영자용 기본 조치 안내.
     *
     * @return 조치 안내 문구
     */
    public String remediation() {
        return remediation;
    }
}
