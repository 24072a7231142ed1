package com.ryuqq.analysis.testkit.contract;

import com.ryuqq.analysis.application.pipeline.PipelineConfig;
import com.ryuqq.analysis.application.pipeline.RunReport;
import com.ryuqq.analysis.application.pipeline.ModelAssignment;
import com.ryuqq.analysis.application.pipeline.VerificationReport;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.outcome.DocumentFailureKind;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import com.ryuqq.analysis.testkit.contract.ScriptedModelGateway.CallKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 문서 단위 부분 실패.
 *
 * <p>문서 하나의 실패는 Run을 멈추지 않고, 실패 비율이 임계값을 넘을 때만 중단됩니다.
 * 통합과 종합은 성공한 문서만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PartialFailureContractTest extends AbstractPipelineContractTest {

    @BeforeEach
    void setUp() {
        registerFramework("sentiment", "tone", "clarity");
    }

    @Test
    void testOneFailedDocument_RunCompletesWithRemainingFour() {
        // Given
        gateway.failDocument("doc-3", () -> new IllegalStateException("401 Unauthorized"));

        // When
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(5)));

        // Then
        assertCompleted(report);
        assertEquals(4, report.analyzedDocuments().size());
        assertEquals(1, report.failedDocuments().size());

        Failed failed = report.failedDocuments().get(0);
        assertEquals("doc-3", failed.documentName());
        assertEquals(DocumentFailureKind.PROVIDER_REJECTED, failed.kind());
        assertEquals(1, gateway.callCount("doc-3"), "authentication errors are not retried");

        double expectedTone = mean("sentiment.tone", "doc-1", "doc-2", "doc-4", "doc-5");
        assertEquals(expectedTone, report.synthesis().claimedMetrics().get("sentiment.tone"), 1e-9);

        VerificationReport verification = report.verification();
        assertTrue(verification.passed(), "verification discrepancies: " + verification.discrepancies());
        assertEquals(4, verification.documentCount());

        assertTrue(report.artifacts().keySet().containsAll(
            List.of("consolidation", "synthesis", "verification", "run-record")));
        assertAudited(report, AuditEventType.DOCUMENT_FAILED);
        assertAudited(report, AuditEventType.RUN_COMPLETED);
    }

    @Test
    void testUnparseableResponse_FailsDocumentAndKeepsRawResponse() {
        // Given
        gateway.garble("doc-2");

        // When
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(4)));

        // Then
        assertCompleted(report);
        Failed failed = report.failedDocuments().get(0);
        assertEquals("doc-2", failed.documentName());
        assertEquals(DocumentFailureKind.LOW_CONFIDENCE, failed.kind());
        assertNotNull(failed.rawResponseRef());
        assertEquals("I am not able to score this document.",
            new String(artifactStore.get(failed.rawResponseRef()), StandardCharsets.UTF_8));
    }

    @Test
    void testFailuresAboveThreshold_HaltAndSkipRemainingDocuments() {
        // Given: 5개 중 3개 실패 → 0.6 > 0.5
        for (String name : List.of("doc-1", "doc-2", "doc-3")) {
            gateway.failDocument(name, () -> new IllegalStateException("403 Forbidden"));
        }
        newRunner(ModelAssignment.single(PRIMARY), new PipelineConfig().withConcurrency(1).withFailureThreshold(0.5));

        // When
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(5)));

        // Then
        assertEquals(RunStatus.ABORTED, report.status());
        assertTrue(report.failureReason().contains("3/5"), report.failureReason());
        assertEquals(5, report.failedDocuments().size());
        assertEquals(DocumentFailureKind.CANCELLED, report.failedDocuments().get(3).kind());
        assertEquals(DocumentFailureKind.CANCELLED, report.failedDocuments().get(4).kind());
        assertEquals(0, gateway.callCount("doc-4"));
        assertEquals(0, gateway.callCount("doc-5"));
        assertEquals(0, gateway.callCount(CallKind.SYNTHESIS));
        assertNotAudited(report, AuditEventType.RESULTS_CONSOLIDATED);
        assertAudited(report, AuditEventType.RUN_ABORTED);
    }

    @Test
    void testEvidenceIntegrationDisabled_UsesAnalyticalReport() {
        // Given
        newRunner(ModelAssignment.single(PRIMARY), pipelineConfig().withEvidenceIntegration(false));

        // When
        RunReport report = runner.run(request(List.of(registered("sentiment")), documents(2)));

        // Then
        assertCompleted(report);
        assertFalse(report.synthesis().evidenceIntegrated());
        assertEquals(report.synthesis().analyticalReport(), report.synthesis().report());
        assertEquals(0, gateway.callCount(CallKind.EVIDENCE));
    }

    private static double mean(String key, String... documents) {
        double sum = 0;
        for (String document : documents) {
            sum += ScriptedModelGateway.scoreFor(document, key, 0.0, 10.0);
        }
        return sum / documents.length;
    }
}
