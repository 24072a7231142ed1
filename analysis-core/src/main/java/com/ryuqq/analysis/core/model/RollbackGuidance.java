package com.ryuqq.analysis.core.model;

import java.util.List;

/**
 * 프레임워크 트랜잭션 실패 시 운영자에게 제공하는 롤백 안내.
 *
 * <p>실패한 프레임워크마다 원인과 조치 방법을 하나씩 가지며,
 * 트랜잭션 중 발급되었다가 되돌린 버전 목록을 함께 담습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failures 실패한 프레임워크 목록
 * @param revertedVersions 롤백으로 삭제된 버전
 */
public record RollbackGuidance(
    List<FailedFramework> failures,
    List<FrameworkVersion> revertedVersions
) {

    public RollbackGuidance {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        failures = List.copyOf(failures);
        revertedVersions = revertedVersions == null ? List.of() : List.copyOf(revertedVersions);
    }

    /**
     * 실패한 프레임워크 이름 목록.
     */
    public List<String> failedFrameworkNames() {
        return failures.stream().map(FailedFramework::name).toList();
    }

    /**
     * 사람이 읽는 안내문.
     *
     * @return 여러 줄 텍스트
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Framework transaction failed: ")
            .append(failures.size())
            .append(" framework(s) did not validate\n");
        for (FailedFramework failure : failures) {
            sb.append("- ").append(failure.name())
                .append(" [").append(failure.kind()).append("] ")
                .append(failure.reason()).append('\n')
                .append("  remediation: ").append(failure.remediation()).append('\n');
        }
        if (!revertedVersions.isEmpty()) {
            sb.append("Reverted versions:");
            for (FrameworkVersion version : revertedVersions) {
                sb.append(' ').append(version.name()).append(" v").append(version.version());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 실패한 프레임워크 하나.
     *
     * @param name 프레임워크 이름
     * @param kind 실패 분류
     * @param reason 구체적인 원인
     * @param remediation 조치 안내
     */
    public record FailedFramework(
        String name,
        FrameworkFailureKind kind,
        String reason,
        String remediation
    ) {

        public FailedFramework {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            reason = reason == null ? "" : reason;
            remediation = remediation == null ? kind.remediation() : remediation;
        }

        public static FailedFramework of(String name, FrameworkFailureKind kind, String reason) {
            return new FailedFramework(name, kind, reason, kind.remediation());
        }
    }
}
