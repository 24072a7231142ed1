package com.ryuqq.analysis.testkit.contract;

import com.ryuqq.analysis.application.pipeline.RunReport;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentSource;
import com.ryuqq.analysis.core.model.FrameworkFailureKind;
import com.ryuqq.analysis.core.model.FrameworkRef;
import com.ryuqq.analysis.core.model.FrameworkVersion;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RollbackGuidance;
import com.ryuqq.analysis.core.statemachine.FrameworkValidationState;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 프레임워크 검증의 원자성.
 *
 * <p>하나라도 실패하면 Run은 분석 전에 중단되고, 이번 Run에서 새로 만든 버전은 모두 되돌려지며,
 * 안내에는 실패한 프레임워크만 정확히 나옵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FrameworkAtomicityContractTest extends AbstractPipelineContractTest {

    @BeforeEach
    void setUp() {
        registerFramework("alpha", "tone");
        registerFramework("beta", "clarity");
        registerFramework("gamma", "focus");
        registerFramework("epsilon", "depth");
    }

    @Test
    void testTwoOfFiveFrameworksFail_RunAbortsBeforeAnalysisWithExactGuidance() {
        // Given
        List<FrameworkRef> refs = List.of(
            registered("alpha"),
            registered("beta"),
            FrameworkRef.withLocalCopy("gamma", ContentSource.of(frameworkJson("gamma", "focus", "pace"))),
            registered("delta"),
            FrameworkRef.withLocalCopy("epsilon", ContentSource.of("not json".getBytes(StandardCharsets.UTF_8)))
        );

        // When
        RunReport report = runner.run(request(refs, documents(3)));

        // Then: 분석 전에 중단
        assertEquals(RunStatus.ABORTED, report.status());
        assertTrue(gateway.calls().isEmpty(), "no provider call should be made");
        assertNull(report.phase(Phase.ANALYSIS));
        assertTrue(report.documents().isEmpty());
        assertEquals("Framework validation failed: delta, epsilon", report.failureReason());

        // Then: 실패한 두 개만 안내
        RollbackGuidance guidance = report.guidance();
        assertEquals(List.of("delta", "epsilon"), guidance.failedFrameworkNames());
        assertEquals(FrameworkFailureKind.MISSING_REGISTRY, guidance.failures().get(0).kind());
        assertEquals(FrameworkFailureKind.MALFORMED, guidance.failures().get(1).kind());
        assertTrue(report.remediation().contains(FrameworkFailureKind.MISSING_REGISTRY.remediation()));

        // Then: gamma v2는 되돌려짐
        assertEquals(1, guidance.revertedVersions().size());
        assertEquals("gamma", guidance.revertedVersions().get(0).name());
        assertEquals(2, guidance.revertedVersions().get(0).version());
        assertEquals(1, registry.findVersions("gamma").size());

        report.frameworks().forEach(status ->
            assertEquals(FrameworkValidationState.ROLLED_BACK, status.state(), status.name()));
        assertAudited(report, AuditEventType.FRAMEWORK_VERSION_ROLLED_BACK);
        assertNotAudited(report, AuditEventType.FRAMEWORK_COMMITTED);
    }

    @Test
    void testChangedLocalCopy_MintsAndCommitsNextVersion() {
        // Given
        byte[] changed = frameworkJson("gamma", "focus", "pace");

        // When
        RunReport report = runner.run(request(
            List.of(registered("alpha"), FrameworkRef.withLocalCopy("gamma", ContentSource.of(changed))),
            documents(2)));

        // Then
        assertCompleted(report);
        List<FrameworkVersion> versions = registry.findVersions("gamma");
        assertEquals(2, versions.size());
        assertEquals(2, versions.get(1).version());

        RunReport.FrameworkStatus gamma = report.frameworks().stream()
            .filter(status -> status.name().equals("gamma"))
            .findFirst()
            .orElseThrow();
        assertEquals(2, gamma.version());
        assertEquals(FrameworkValidationState.COMMITTED, gamma.state());
        assertTrue(report.analyzedDocuments().get(0).scores().containsKey("gamma.pace"));
        assertAudited(report, AuditEventType.FRAMEWORK_VERSION_MINTING);
    }

    @Test
    void testPinnedVersionMismatch_AbortsWithVersionGuidance() {
        // When
        RunReport report = runner.run(request(List.of(registered("alpha").pinnedTo(3)), documents(1)));

        // Then
        assertEquals(RunStatus.ABORTED, report.status());
        assertEquals(FrameworkFailureKind.VERSION_MISMATCH, report.guidance().failures().get(0).kind());
        assertTrue(report.guidance().revertedVersions().isEmpty());
    }
}
