package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.reliability.ReliableModelClient;
import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.application.transaction.FrameworkDefinition;
import com.ryuqq.analysis.application.transaction.ValidatedFramework;
import com.ryuqq.analysis.core.exception.CircuitOpenException;
import com.ryuqq.analysis.core.exception.ProviderExhaustedException;
import com.ryuqq.analysis.core.exception.TerminalProviderException;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.Document;
import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentFailureKind;
import com.ryuqq.analysis.core.outcome.DocumentOutcome;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import com.ryuqq.analysis.core.spi.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 문서 하나의 분석.
 *
 * <p>Provider 오류와 파싱 실패를 {@link Failed}로 변환해 격리합니다.
 * 결과 Artifact 저장과 감사 이벤트 기록이 끝난 뒤에 결과를 반환합니다.</p>
 *
 * <p><strong>실패 분류:</strong></p>
 * <ul>
 *   <li>ProviderExhaustedException → PROVIDER_EXHAUSTED</li>
 *   <li>TerminalProviderException → PROVIDER_REJECTED</li>
 *   <li>CircuitOpenException → CIRCUIT_OPEN</li>
 *   <li>파싱 불가 또는 점수 누락/범위 초과 → LOW_CONFIDENCE (원문 Artifact 보관)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DocumentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private final ReliableModelClient client;
    private final AnalysisPrompts prompts;
    private final ResponseExtractor extractor;
    private final ArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final Clock clock;

    public DocumentAnalyzer(ReliableModelClient client, AnalysisPrompts prompts, ResponseExtractor extractor,
                            ArtifactStore artifactStore, AuditLog auditLog, Clock clock) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (prompts == null) {
            throw new IllegalArgumentException("prompts cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.client = client;
        this.prompts = prompts;
        this.extractor = extractor;
        this.artifactStore = artifactStore;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * 문서 분석.
     *
     * @param runId Run
     * @param document 문서
     * @param frameworks 검증된 프레임워크 전체
     * @param models 모델 배정
     * @return Analyzed 또는 Failed
     */
    public DocumentOutcome analyze(RunId runId, Document document, List<ValidatedFramework> frameworks,
                                   ModelAssignment models) {
        ModelResponse response;
        try {
            ModelRequest request = new ModelRequest(models.analysisModel(),
                prompts.analysisPrompt(frameworks, document),
                prompts.analysisSchema(frameworks),
                client.getPolicy().callDeadline());
            response = client.call(request, models.failover());
        } catch (ProviderExhaustedException e) {
            return fail(runId, Failed.of(document.name(), DocumentFailureKind.PROVIDER_EXHAUSTED, messageOf(e)));
        } catch (TerminalProviderException e) {
            return fail(runId, Failed.of(document.name(), DocumentFailureKind.PROVIDER_REJECTED, messageOf(e)));
        } catch (CircuitOpenException e) {
            return fail(runId, Failed.of(document.name(), DocumentFailureKind.CIRCUIT_OPEN, messageOf(e)));
        }

        Extraction extraction = extractor.extract(response);
        if (extraction instanceof Extraction.LowConfidence lowConfidence) {
            return lowConfidence(runId, document, lowConfidence.reason(), lowConfidence.rawResponse());
        }

        Extraction.Parsed parsed = (Extraction.Parsed) extraction;
        Map<String, Double> scores = new LinkedHashMap<>();
        String problem = readScores(parsed.payload(), frameworks, scores);
        if (problem != null) {
            return lowConfidence(runId, document, problem, rawOf(response));
        }

        DocumentAnalysisRecord record = new DocumentAnalysisRecord(
            document.name(),
            document.contentHash().getValue(),
            response.model().getValue(),
            scores,
            readEvidence(parsed.payload()),
            parsed.source().name()
        );
        ContentHash artifactRef = artifactStore.put(JsonCodec.write(record));
        auditLog.append(new AuditEvent(runId, Phase.ANALYSIS, AuditEventType.DOCUMENT_ANALYZED,
            artifactRef, document.name(), clock.instant()));
        log.debug("Document {} analyzed by {} → {}", document.name(), response.model(), artifactRef);
        return new Analyzed(document.name(), artifactRef, response.model(), scores);
    }

    /**
     * 프레임워크마다 모든 차원의 점수가 범위 안에 있어야 합니다.
     *
     * @return 문제 설명 (정상이면 null)
     */
    static String readScores(JsonNode payload, List<ValidatedFramework> frameworks, Map<String, Double> scores) {
        JsonNode scoreNode = payload.path("scores");
        if (!scoreNode.isObject()) {
            return "Response has no scores object";
        }
        for (ValidatedFramework framework : frameworks) {
            JsonNode frameworkScores = scoreNode.path(framework.name());
            for (FrameworkDefinition.Dimension dimension : framework.definition().dimensions()) {
                String key = framework.name() + "." + dimension.name();
                JsonNode value = frameworkScores.path(dimension.name());
                if (!value.isNumber()) {
                    return "Missing score for " + key;
                }
                double score = value.doubleValue();
                if (Double.isNaN(score) || score < dimension.minScore() || score > dimension.maxScore()) {
                    return String.format("Score %s=%s outside [%s, %s]", key, score, dimension.minScore(), dimension.maxScore());
                }
                scores.put(key, score);
            }
        }
        return null;
    }

    private static List<String> readEvidence(JsonNode payload) {
        List<String> evidence = new ArrayList<>();
        JsonNode nodes = payload.path("evidence");
        if (nodes.isArray()) {
            nodes.forEach(node -> evidence.add(node.asText()));
        }
        return evidence;
    }

    private DocumentOutcome lowConfidence(RunId runId, Document document, String reason, String raw) {
        ContentHash rawRef = artifactStore.put(raw.getBytes(StandardCharsets.UTF_8));
        return fail(runId, new Failed(document.name(), DocumentFailureKind.LOW_CONFIDENCE, reason, rawRef));
    }

    private DocumentOutcome fail(RunId runId, Failed failed) {
        auditLog.append(new AuditEvent(runId, Phase.ANALYSIS, AuditEventType.DOCUMENT_FAILED,
            failed.rawResponseRef(), failed.documentName() + " " + failed.kind() + ": " + failed.message(), clock.instant()));
        log.warn("Document {} failed ({}): {}", failed.documentName(), failed.kind(), failed.message());
        return failed;
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String rawOf(ModelResponse response) {
        return response.hasStructuredPayload() ? response.structuredPayload() : response.text();
    }
}
