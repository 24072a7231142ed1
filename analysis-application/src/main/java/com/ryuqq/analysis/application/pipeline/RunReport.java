package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.application.cache.CacheEfficiency;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RollbackGuidance;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentOutcome;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.statemachine.FrameworkValidationState;
import com.ryuqq.analysis.core.statemachine.RunStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Run 최종 보고서.
 *
 * <p>실패 원인은 스택 트레이스가 아니라 실패한 프레임워크/문서 이름과 조치 안내로 표현됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runId Run
 * @param status 종료 상태
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각
 * @param phases 단계별 기록 (실행된 단계만)
 * @param cacheHits 전체 캐시 Hit
 * @param cacheMisses 전체 캐시 Miss
 * @param frameworks 프레임워크별 상태
 * @param documents 문서별 결과 (분석 단계에 도달하지 못했으면 빈 목록)
 * @param failureReason 실패 원인 (성공이면 null)
 * @param remediation 조치 안내 (성공이면 null)
 * @param guidance 프레임워크 롤백 안내 (프레임워크 실패가 아니면 null)
 * @param verification 검증 결과 (검증 단계 전이면 null)
 * @param synthesis 종합 결과 (종합 단계 전이면 null)
 * @param artifacts 이름 → Artifact 해시 (consolidation, synthesis, verification, run-record)
 * @param performanceScore 성능 점수 (0~100)
 */
public record RunReport(
    RunId runId,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    List<PhaseTiming> phases,
    long cacheHits,
    long cacheMisses,
    List<FrameworkStatus> frameworks,
    List<DocumentOutcome> documents,
    String failureReason,
    String remediation,
    RollbackGuidance guidance,
    VerificationReport verification,
    SynthesisResult synthesis,
    Map<String, ContentHash> artifacts,
    double performanceScore
) {

    public RunReport {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        phases = phases == null ? List.of() : List.copyOf(phases);
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        documents = documents == null ? List.of() : List.copyOf(documents);
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public Duration totalDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    public double cacheHitRate() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }

    public CacheEfficiency cacheEfficiency() {
        return CacheEfficiency.classify(cacheHits, cacheMisses);
    }

    public List<Analyzed> analyzedDocuments() {
        return documents.stream()
            .filter(Analyzed.class::isInstance)
            .map(Analyzed.class::cast)
            .toList();
    }

    public List<Failed> failedDocuments() {
        return documents.stream()
            .filter(Failed.class::isInstance)
            .map(Failed.class::cast)
            .toList();
    }

    /**
     * 해당 단계 기록 (실행되지 않았으면 null).
     */
    public PhaseTiming phase(Phase phase) {
        return phases.stream().filter(timing -> timing.phase() == phase).findFirst().orElse(null);
    }

    /**
     * 로그와 CLI 출력용 요약.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder()
            .append("Run ").append(runId).append(": ").append(status)
            .append(" in ").append(totalDuration().toMillis()).append("ms")
            .append(String.format(", score %.1f", performanceScore))
            .append(String.format(", cache %d/%d (%s)", cacheHits, cacheHits + cacheMisses, cacheEfficiency()));

        if (!documents.isEmpty()) {
            sb.append(", documents ").append(analyzedDocuments().size()).append(" ok / ")
                .append(failedDocuments().size()).append(" failed");
        }
        if (!phases.isEmpty()) {
            sb.append(phases.stream()
                .map(timing -> timing.phase() + "=" + timing.duration().toMillis() + "ms")
                .collect(Collectors.joining(", ", " [", "]")));
        }
        if (failureReason != null) {
            sb.append("\n  reason: ").append(failureReason);
        }
        if (remediation != null) {
            sb.append("\n  remediation: ").append(remediation);
        }
        for (Failed failed : failedDocuments()) {
            sb.append("\n  document ").append(failed.documentName()).append(" ").append(failed.kind())
                .append(": ").append(failed.message()).append(" (").append(failed.kind().remediation()).append(")");
        }
        return sb.toString();
    }

    /**
     * 프레임워크 하나의 상태.
     *
     * @param name 이름
     * @param version 사용된 버전 (검증 실패 시 null)
     * @param state 최종 트랜잭션 상태
     * @param coherent Coherence 검증 통과 여부 (검증 전이면 null)
     */
    public record FrameworkStatus(String name, Integer version, FrameworkValidationState state, Boolean coherent) {
    }
}
