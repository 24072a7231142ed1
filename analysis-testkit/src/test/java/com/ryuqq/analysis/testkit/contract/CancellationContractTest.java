package com.ryuqq.analysis.testkit.contract;

import com.ryuqq.analysis.application.pipeline.RunReport;
import com.ryuqq.analysis.application.pipeline.RunRequest;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.outcome.DocumentFailureKind;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import com.ryuqq.analysis.testkit.contract.ScriptedModelGateway.CallKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 협조적 취소.
 *
 * <p>취소 요청 이후 새 문서는 시작되지 않고, 진행 중이던 호출은 끝까지 수행되며,
 * Run은 CANCELLED로 종료되어 감사 기록이 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractPipelineContractTest {

    @Test
    void testCancelDuringAnalysis_StopsRemainingDocuments() {
        // Given
        registerFramework("sentiment", "tone");
        RunRequest request = request(List.of(registered("sentiment")), documents(5));
        gateway.onCall(call -> {
            if ("doc-2".equals(call.documentName())) {
                assertTrue(runner.cancel(request.runId()));
            }
        });

        // When
        RunReport report = runner.run(request);

        // Then
        assertEquals(RunStatus.CANCELLED, report.status());
        assertEquals(2, report.analyzedDocuments().size(), "in-flight document should finish");
        List<Failed> skipped = report.failedDocuments();
        assertEquals(3, skipped.size());
        skipped.forEach(failed -> assertEquals(DocumentFailureKind.CANCELLED, failed.kind()));
        assertEquals(0, gateway.callCount("doc-3"));
        assertEquals(0, gateway.callCount(CallKind.SYNTHESIS));
        assertEquals(0, runner.activeRunCount());
        assertAudited(report, AuditEventType.RUN_ABORTED);
        assertTrue(report.artifacts().containsKey("run-record"));
    }

    @Test
    void testCancelDuringValidation_AbortsBeforeAnalysis() {
        // Given
        registerFramework("sentiment", "tone");
        registerFramework("clarity", "structure");
        RunRequest request = request(List.of(registered("sentiment"), registered("clarity")), documents(2));
        gateway.onCall(call -> {
            if (call.kind() == CallKind.COHERENCE) {
                runner.cancel(request.runId());
            }
        });

        // When
        RunReport report = runner.run(request);

        // Then
        assertEquals(RunStatus.CANCELLED, report.status());
        assertEquals(1, gateway.callCount(CallKind.COHERENCE));
        assertEquals(0, gateway.callCount(CallKind.ANALYSIS));
    }

    @Test
    void testCancelUnknownRun_ReturnsFalse() {
        assertFalse(runner.cancel(RunId.of("not-running")));
    }
}
