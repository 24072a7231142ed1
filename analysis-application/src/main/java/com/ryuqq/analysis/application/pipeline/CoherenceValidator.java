package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.cache.CacheLookup;
import com.ryuqq.analysis.application.cache.CoherenceValidation;
import com.ryuqq.analysis.application.cache.ValidationCacheManager;
import com.ryuqq.analysis.application.reliability.ReliableModelClient;
import com.ryuqq.analysis.application.transaction.ValidatedFramework;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.CacheKey;
import com.ryuqq.analysis.core.model.Document;
import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.spi.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 캐시를 거치는 Coherence 검증.
 *
 * <p>Hit이면 모델을 호출하지 않고 저장된 결과를 그대로 반환합니다.
 * Miss이면 모델을 호출하고 결과(실패 포함)를 캐시에 저장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CoherenceValidator {

    private static final Logger log = LoggerFactory.getLogger(CoherenceValidator.class);

    private final ValidationCacheManager cacheManager;
    private final ReliableModelClient client;
    private final AnalysisPrompts prompts;
    private final ResponseExtractor extractor;
    private final AuditLog auditLog;
    private final Clock clock;

    public CoherenceValidator(ValidationCacheManager cacheManager, ReliableModelClient client, AnalysisPrompts prompts,
                              ResponseExtractor extractor, AuditLog auditLog, Clock clock) {
        if (cacheManager == null) {
            throw new IllegalArgumentException("cacheManager cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (prompts == null) {
            throw new IllegalArgumentException("prompts cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cacheManager = cacheManager;
        this.client = client;
        this.prompts = prompts;
        this.extractor = extractor;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * 프레임워크 하나의 Coherence 검증.
     *
     * @param context Run 상태 (캐시 카운터 기록)
     * @param framework 검증된 프레임워크
     * @param experiment 실험 정의
     * @param corpus 코퍼스
     * @param models 모델 배정
     * @return 검증 결과 (실패 결과도 예외 없이 반환)
     */
    public CoherenceValidation validate(RunContext context, ValidatedFramework framework, Document experiment,
                                        Document corpus, ModelAssignment models) {
        CacheKey key = cacheManager.generateCacheKey(framework.content(), experiment.content(), corpus.content(),
            models.validationModel());

        CacheLookup lookup = cacheManager.checkCache(key);
        if (lookup instanceof CacheLookup.Hit hit) {
            context.recordCacheHit();
            auditLog.append(new AuditEvent(context.runId(), Phase.VALIDATION, AuditEventType.CACHE_HIT,
                hit.entry().artifactRef(), key.getValue(), clock.instant()));
            return hit.result();
        }

        context.recordCacheMiss();
        CacheLookup.MissReason reason = ((CacheLookup.Miss) lookup).reason();
        auditLog.append(new AuditEvent(context.runId(), Phase.VALIDATION, AuditEventType.CACHE_MISS,
            null, key.getValue() + " " + reason, clock.instant()));
        log.info("Validation cache miss for {} ({}), running coherence check with {}",
            framework.name(), reason, models.validationModel());

        ModelRequest request = new ModelRequest(models.validationModel(),
            prompts.coherencePrompt(framework, experiment, corpus),
            prompts.coherenceSchema(),
            client.getPolicy().callDeadline());
        ModelResponse response = client.call(request, models.failover());

        CoherenceValidation result = toValidation(framework.name(), extractor.extract(response));
        cacheManager.storeValidationResult(context.runId(), key, result, models.validationModel());
        return result;
    }

    static CoherenceValidation toValidation(String frameworkName, Extraction extraction) {
        if (extraction instanceof Extraction.LowConfidence lowConfidence) {
            return CoherenceValidation.failed(frameworkName, "Validation response could not be parsed",
                List.of(lowConfidence.reason()));
        }
        JsonNode payload = ((Extraction.Parsed) extraction).payload();
        JsonNode coherent = payload.get("coherent");
        if (coherent == null || !coherent.isBoolean()) {
            return CoherenceValidation.failed(frameworkName, "Validation response has no coherent flag",
                List.of("missing field: coherent"));
        }

        List<String> issues = new ArrayList<>();
        JsonNode issueNodes = payload.path("issues");
        if (issueNodes.isArray()) {
            issueNodes.forEach(issue -> issues.add(issue.asText()));
        }
        String summary = payload.path("summary").asText("");
        return coherent.booleanValue()
            ? new CoherenceValidation(frameworkName, true, summary, issues)
            : CoherenceValidation.failed(frameworkName, summary, issues);
    }
}
