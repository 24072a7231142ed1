package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentOutcome;
import com.ryuqq.analysis.core.outcome.Failed;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run 종료 시 Artifact로 저장하는 기록.
 *
 * <p>Artifact 해시가 내용으로 결정되므로 모든 필드는 직렬화 결과가 고정되는
 * 문자열과 숫자만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunRecord(
    String runId,
    String status,
    String startedAt,
    String finishedAt,
    Map<String, Long> phaseDurationsMs,
    long cacheHits,
    long cacheMisses,
    List<String> frameworks,
    Map<String, String> documents,
    String failureReason,
    String remediation,
    Boolean verificationPassed,
    Map<String, String> artifacts,
    double performanceScore
) {

    /**
     * 보고서에서 기록 생성 (run-record 자신의 해시는 포함하지 않음).
     */
    public static RunRecord from(RunReport report) {
        Map<String, Long> phaseDurations = new LinkedHashMap<>();
        report.phases().forEach(timing -> phaseDurations.put(timing.phase().name(), timing.duration().toMillis()));

        List<String> frameworks = report.frameworks().stream()
            .map(framework -> framework.name()
                + (framework.version() == null ? "" : "@v" + framework.version())
                + " " + framework.state())
            .toList();

        Map<String, String> documents = new LinkedHashMap<>();
        for (DocumentOutcome outcome : report.documents()) {
            if (outcome instanceof Analyzed analyzed) {
                documents.put(analyzed.documentName(), "ANALYZED " + analyzed.artifactRef().getValue());
            } else if (outcome instanceof Failed failed) {
                documents.put(failed.documentName(), "FAILED " + failed.kind() + ": " + failed.message());
            }
        }

        Map<String, String> artifacts = new LinkedHashMap<>();
        report.artifacts().forEach((name, hash) -> artifacts.put(name, hash.getValue()));

        return new RunRecord(
            report.runId().getValue(),
            report.status().name(),
            report.startedAt().toString(),
            report.finishedAt().toString(),
            phaseDurations,
            report.cacheHits(),
            report.cacheMisses(),
            frameworks,
            documents,
            report.failureReason(),
            report.remediation(),
            report.verification() == null ? null : report.verification().passed(),
            artifacts,
            report.performanceScore()
        );
    }
}
