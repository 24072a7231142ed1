package com.ryuqq.analysis.testkit.contract;

import com.ryuqq.analysis.application.pipeline.ModelAssignment;
import com.ryuqq.analysis.application.pipeline.RunReport;
import com.ryuqq.analysis.application.reliability.ProviderHealthSnapshot;
import com.ryuqq.analysis.core.exception.ProviderErrorType;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentFailureKind;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.protection.CircuitBreakerState;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import com.ryuqq.analysis.testkit.contract.ScriptedModelGateway.CallKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 재시도, Circuit Breaker, Failover.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProviderReliabilityContractTest extends AbstractPipelineContractTest {

    private static final ModelId VALIDATOR = ModelId.of("scripted/validator");

    @BeforeEach
    void setUp() {
        registerFramework("sentiment", "tone");
    }

    // ============================================================
    // 재시도
    // ============================================================

    @Test
    void 일시적_오류는_지수_백오프로_재시도되어_성공() {
        // given
        gateway.failDocument("doc-1", 2, () -> new IllegalStateException("503 Service Unavailable"));

        // when
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(2)));

        // then
        assertCompleted(report);
        assertThat(report.analyzedDocuments()).hasSize(2);
        assertThat(gateway.callCount("doc-1")).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(client.health(PRIMARY).retries()).isEqualTo(2);
    }

    @Test
    void 레이트리밋은_고정_65초_대기_후_재시도() {
        // given
        gateway.failDocument("doc-1", 1, () -> new IllegalStateException("429 Too Many Requests"));

        // when
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(1)));

        // then
        assertCompleted(report);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(65));
        assertThat(client.health(PRIMARY).failuresByType()).containsEntry(ProviderErrorType.RATE_LIMIT, 1L);
    }

    @Test
    void 인증_오류는_재시도하지_않음() {
        // given
        gateway.failDocument("doc-1", () -> new IllegalStateException("401 Unauthorized: invalid api key"));

        // when
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(3)));

        // then
        assertCompleted(report);
        assertThat(gateway.callCount("doc-1")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(report.failedDocuments()).extracting(Failed::kind)
            .containsExactly(DocumentFailureKind.PROVIDER_REJECTED);
    }

    // ============================================================
    // Circuit Breaker와 Failover
    // ============================================================

    @Test
    void 회로가_열리면_보조_모델로_failover_하고_주_모델은_호출하지_않음() {
        // given
        gateway.failModel(PRIMARY, () -> new IllegalStateException("500 Internal Server Error"));
        newRunner(new ModelAssignment(VALIDATOR, PRIMARY, VALIDATOR, List.of(SECONDARY)), pipelineConfig());

        // when
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(4)));

        // then
        assertCompleted(report);
        assertThat(report.analyzedDocuments()).hasSize(4)
            .extracting(Analyzed::model)
            .containsOnly(SECONDARY);
        assertThat(gateway.callCount(PRIMARY)).isEqualTo(3);

        ProviderHealthSnapshot primary = client.health(PRIMARY);
        assertThat(primary.breakerState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(primary.rejections()).isEqualTo(3);
        assertThat(primary.healthy()).isFalse();
        assertThat(client.health(SECONDARY).healthy()).isTrue();
    }

    @Test
    void 모든_경로가_막히면_문서는_CIRCUIT_OPEN으로_실패() {
        // given
        gateway.failModel(PRIMARY, () -> new IllegalStateException("502 Bad Gateway"));
        newRunner(new ModelAssignment(VALIDATOR, PRIMARY, VALIDATOR, List.of()),
            pipelineConfig().withFailureThreshold(1.0));

        // when
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(3)));

        // then
        assertThat(report.status()).isEqualTo(RunStatus.ABORTED);
        assertThat(report.failureReason()).isEqualTo("No document was analyzed successfully");
        assertThat(report.failedDocuments()).extracting(Failed::kind).containsExactly(
            DocumentFailureKind.PROVIDER_EXHAUSTED,
            DocumentFailureKind.CIRCUIT_OPEN,
            DocumentFailureKind.CIRCUIT_OPEN);
        assertThat(gateway.callCount(PRIMARY)).isEqualTo(3);
    }

    @Test
    void 쿨다운이_지나면_탐침_호출로_회로가_닫힘() {
        // given: 주 모델이 한 문서 동안 실패해 회로가 열림
        gateway.failDocument("doc-1", 3, () -> new IllegalStateException("overloaded"));
        newRunner(new ModelAssignment(VALIDATOR, PRIMARY, VALIDATOR, List.of(SECONDARY)), pipelineConfig());
        runner.run(request(List.of(registered("sentiment")), List.of(document("doc-1", "first"))));
        assertThat(client.breakerFor(PRIMARY).getState()).isEqualTo(CircuitBreakerState.OPEN);

        // when: 쿨다운 경과 후 다음 Run
        clock.advance(Duration.ofSeconds(61));
        RunReport report = runner.run(request(List.of(registered("sentiment")), List.of(document("doc-2", "second"))));

        // then
        assertCompleted(report);
        assertThat(report.analyzedDocuments().get(0).model()).isEqualTo(PRIMARY);
        assertThat(client.breakerFor(PRIMARY).getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(gateway.calls()).filteredOn(call -> call.kind() == CallKind.ANALYSIS).hasSize(5);
    }
}
