package com.ryuqq.analysis.adapter.runner;

import com.ryuqq.analysis.application.cache.CoherenceValidation;
import com.ryuqq.analysis.application.cache.ValidationCacheManager;
import com.ryuqq.analysis.application.pipeline.AnalysisPipeline;
import com.ryuqq.analysis.application.pipeline.AnalysisPrompts;
import com.ryuqq.analysis.application.pipeline.CoherenceValidator;
import com.ryuqq.analysis.application.pipeline.ConsolidatedAnalysis;
import com.ryuqq.analysis.application.pipeline.Consolidator;
import com.ryuqq.analysis.application.pipeline.DefaultAnalysisPrompts;
import com.ryuqq.analysis.application.pipeline.DocumentAnalyzer;
import com.ryuqq.analysis.application.pipeline.ModelAssignment;
import com.ryuqq.analysis.application.pipeline.PerformanceScore;
import com.ryuqq.analysis.application.pipeline.PhaseTiming;
import com.ryuqq.analysis.application.pipeline.PipelineConfig;
import com.ryuqq.analysis.application.pipeline.ResponseExtractor;
import com.ryuqq.analysis.application.pipeline.RunContext;
import com.ryuqq.analysis.application.pipeline.RunRecord;
import com.ryuqq.analysis.application.pipeline.RunReport;
import com.ryuqq.analysis.application.pipeline.RunRequest;
import com.ryuqq.analysis.application.pipeline.StatisticalVerifier;
import com.ryuqq.analysis.application.pipeline.SynthesisResult;
import com.ryuqq.analysis.application.pipeline.Synthesizer;
import com.ryuqq.analysis.application.pipeline.VerificationReport;
import com.ryuqq.analysis.application.reliability.ReliableModelClient;
import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.application.transaction.FrameworkTransaction;
import com.ryuqq.analysis.application.transaction.FrameworkTransactionManager;
import com.ryuqq.analysis.application.transaction.ValidatedFramework;
import com.ryuqq.analysis.core.exception.CircuitOpenException;
import com.ryuqq.analysis.core.exception.CoherenceValidationException;
import com.ryuqq.analysis.core.exception.DocumentAnalysisException;
import com.ryuqq.analysis.core.exception.FailureThresholdExceededException;
import com.ryuqq.analysis.core.exception.FrameworkValidationException;
import com.ryuqq.analysis.core.exception.ProviderException;
import com.ryuqq.analysis.core.exception.ProviderExhaustedException;
import com.ryuqq.analysis.core.exception.RunCancelledException;
import com.ryuqq.analysis.core.exception.SynthesisException;
import com.ryuqq.analysis.core.exception.VerificationException;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.Document;
import com.ryuqq.analysis.core.model.FrameworkRef;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RollbackGuidance;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentFailureKind;
import com.ryuqq.analysis.core.outcome.DocumentOutcome;
import com.ryuqq.analysis.core.outcome.Failed;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import com.ryuqq.analysis.core.spi.AuditLog;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipeline Orchestrator 구현체.
 *
 * <p>Run 하나를 다섯 단계로 실행하고 항상 종료 상태의 {@link RunReport}를 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(request)
 *   ↓
 * VALIDATION     프레임워크 트랜잭션 (실패 시 롤백 + 중단)
 *                → 프레임워크별 Coherence 검증 (캐시 경유, 실패 시 중단)
 *   ↓
 * ANALYSIS       문서별 분석 (고정 크기 worker pool, 실패 격리)
 *                → 실패율이 임계값 초과 시 남은 문서 건너뛰고 중단
 *   ↓
 * CONSOLIDATION  모든 문서 결과 확정 후 병합 → Artifact
 *   ↓
 * SYNTHESIS      분석 보고서 (+ 근거 통합) → Artifact
 *   ↓
 * VERIFICATION   저장된 Artifact로 통계 재계산 → Artifact
 *   ↓
 * Run 기록 Artifact 저장 → 감사 이벤트 → RunReport 반환
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>문서 분석만 worker pool에서 병렬 실행 (config.concurrency)</li>
 *   <li>병합 이후 단계는 호출 스레드에서 순차 실행</li>
 *   <li>취소 플래그는 문서 사이와 단계 사이에서 확인</li>
 * </ul>
 *
 * <p><strong>감사 순서:</strong> 각 결과는 Artifact 저장과 감사 이벤트 기록이 끝난 뒤에
 * 보고서에 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PipelineRunner implements AnalysisPipeline, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final FrameworkTransactionManager transactionManager;
    private final CoherenceValidator coherenceValidator;
    private final DocumentAnalyzer documentAnalyzer;
    private final Consolidator consolidator;
    private final Synthesizer synthesizer;
    private final StatisticalVerifier verifier;
    private final ArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final ModelAssignment models;
    private final PipelineConfig config;
    private final Clock clock;
    private final ExecutorService workerExecutor;

    private final ConcurrentHashMap<RunId, RunContext> activeRuns = new ConcurrentHashMap<>();

    /**
     * 생성자 (기본 Prompt 사용).
     */
    public PipelineRunner(FrameworkTransactionManager transactionManager, ValidationCacheManager cacheManager,
                          ReliableModelClient client, ArtifactStore artifactStore, AuditLog auditLog,
                          ModelAssignment models, PipelineConfig config, Clock clock) {
        this(transactionManager, cacheManager, client, new DefaultAnalysisPrompts(), artifactStore, auditLog,
            models, config, clock);
    }

    /**
     * 생성자.
     *
     * @param transactionManager 프레임워크 트랜잭션 관리자
     * @param cacheManager 검증 캐시
     * @param client 신뢰성 계층을 거치는 모델 클라이언트
     * @param prompts Prompt 구성
     * @param artifactStore Artifact 저장소
     * @param auditLog 감사 로그
     * @param models 단계별 모델 배정
     * @param config 파이프라인 설정
     * @param clock 단계 시각 기록용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineRunner(FrameworkTransactionManager transactionManager, ValidationCacheManager cacheManager,
                          ReliableModelClient client, AnalysisPrompts prompts, ArtifactStore artifactStore,
                          AuditLog auditLog, ModelAssignment models, PipelineConfig config, Clock clock) {
        if (transactionManager == null) {
            throw new IllegalArgumentException("transactionManager cannot be null");
        }
        if (cacheManager == null) {
            throw new IllegalArgumentException("cacheManager cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (prompts == null) {
            throw new IllegalArgumentException("prompts cannot be null");
        }
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (models == null) {
            throw new IllegalArgumentException("models cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        ResponseExtractor extractor = new ResponseExtractor();
        this.transactionManager = transactionManager;
        this.coherenceValidator = new CoherenceValidator(cacheManager, client, prompts, extractor, auditLog, clock);
        this.documentAnalyzer = new DocumentAnalyzer(client, prompts, extractor, artifactStore, auditLog, clock);
        this.consolidator = new Consolidator();
        this.synthesizer = new Synthesizer(client, prompts, extractor);
        this.verifier = new StatisticalVerifier(artifactStore);
        this.artifactStore = artifactStore;
        this.auditLog = auditLog;
        this.models = models;
        this.config = config;
        this.clock = clock;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory());
    }

    @Override
    public RunReport run(RunRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RunContext context = new RunContext(request.runId(), clock);
        if (activeRuns.putIfAbsent(request.runId(), context) != null) {
            throw new IllegalArgumentException("Run " + request.runId() + " is already active");
        }

        RunState state = new RunState();
        try {
            audit(context, Phase.VALIDATION, AuditEventType.RUN_STARTED, null,
                request.frameworks().size() + " frameworks, " + request.documents().size() + " documents");
            log.info("Run {} started: {} frameworks, {} documents", request.runId(),
                request.frameworks().size(), request.documents().size());
            return execute(request, context, state);
        } catch (RunCancelledException e) {
            log.warn("Run {} cancelled during {}", request.runId(), context.currentPhase());
            return finish(context, state, RunStatus.CANCELLED, "Run was cancelled",
                "Start a new run; cached validations are reused");
        } catch (RuntimeException e) {
            log.error("Run {} aborted by unexpected failure during {}", request.runId(), context.currentPhase(), e);
            return finish(context, state, RunStatus.ABORTED, "Unexpected failure: " + e.getMessage(),
                "Check the run log for details and retry");
        } finally {
            activeRuns.remove(request.runId());
        }
    }

    @Override
    public boolean cancel(RunId runId) {
        RunContext context = activeRuns.get(runId);
        if (context == null) {
            return false;
        }
        context.cancel();
        log.info("Cancellation requested for run {}", runId);
        return true;
    }

    private RunReport execute(RunRequest request, RunContext context, RunState state) {
        // 1. Validation
        List<ValidatedFramework> frameworks = validateFrameworks(request, context, state);
        if (frameworks == null) {
            return finish(context, state, RunStatus.ABORTED, state.failureReason, state.remediation);
        }
        if (!checkCoherence(request, context, state, frameworks)) {
            return finish(context, state, RunStatus.ABORTED, state.failureReason, state.remediation);
        }
        endPhase(context);

        // 2. Analysis
        context.checkCancelled();
        startPhase(context, RunStatus.ANALYZING, Phase.ANALYSIS);
        state.documents.addAll(analyzeDocuments(request, context, frameworks));
        context.checkCancelled();

        int failed = (int) state.documents.stream().filter(DocumentOutcome::isFailed).count();
        int total = state.documents.size();
        if (config.exceedsThreshold(failed, total)) {
            FailureThresholdExceededException e = new FailureThresholdExceededException(failed, total, config.failureThreshold());
            log.error("Run {} halted: {}", request.runId(), e.getMessage());
            return finish(context, state, RunStatus.ABORTED, e.getMessage(),
                "Inspect the failed documents; rerun once the provider is healthy");
        }
        endPhase(context);

        // 3. Consolidation
        context.checkCancelled();
        startPhase(context, RunStatus.CONSOLIDATING, Phase.CONSOLIDATION);
        ConsolidatedAnalysis consolidated = consolidator.consolidate(state.documents);
        if (consolidated.documentCount() == 0) {
            return finish(context, state, RunStatus.ABORTED, "No document was analyzed successfully",
                "Inspect the failed documents; rerun once the provider is healthy");
        }
        store(context, state, "consolidation", AuditEventType.RESULTS_CONSOLIDATED, consolidated,
            consolidated.documentCount() + " documents, " + consolidated.dimensions().size() + " dimensions");
        endPhase(context);

        // 4. Synthesis
        context.checkCancelled();
        startPhase(context, RunStatus.SYNTHESIZING, Phase.SYNTHESIS);
        try {
            state.synthesis = synthesizer.synthesize(consolidated, request.experiment(), models, config.evidenceIntegration());
        } catch (SynthesisException e) {
            log.error("Run {} aborted in synthesis: {}", request.runId(), e.getMessage());
            return finish(context, state, RunStatus.ABORTED, e.getMessage(),
                "Synthesis is retried from scratch on the next run; check provider health");
        }
        store(context, state, "synthesis", AuditEventType.SYNTHESIS_STORED, state.synthesis,
            state.synthesis.claimedMetrics().size() + " metrics cited");
        endPhase(context);

        // 5. Verification
        context.checkCancelled();
        startPhase(context, RunStatus.VERIFYING, Phase.VERIFICATION);
        List<Analyzed> analyzed = state.documents.stream()
            .filter(Analyzed.class::isInstance)
            .map(Analyzed.class::cast)
            .toList();
        try {
            state.verification = verifier.verify(analyzed, consolidated, state.synthesis, config.verificationTolerance());
        } catch (VerificationException e) {
            log.error("Run {} aborted in verification: {}", request.runId(), e.getMessage());
            return finish(context, state, RunStatus.ABORTED, e.getMessage(),
                "Per-document artifacts are missing or unreadable; check the artifact store");
        }
        store(context, state, "verification", AuditEventType.VERIFICATION_STORED, state.verification,
            state.verification.passed() ? "passed" : state.verification.discrepancies().size() + " discrepancies");
        endPhase(context);

        return finish(context, state, RunStatus.COMPLETED, null, null);
    }

    /**
     * 프레임워크 트랜잭션.
     *
     * @return 검증된 프레임워크 (실패 시 null, state에 원인 기록)
     */
    private List<ValidatedFramework> validateFrameworks(RunRequest request, RunContext context, RunState state) {
        startPhase(context, RunStatus.VALIDATING, Phase.VALIDATION);
        FrameworkTransaction transaction = transactionManager.begin(request.runId());
        try {
            List<ValidatedFramework> validated = transaction.validateAll(request.frameworks());
            for (ValidatedFramework framework : validated) {
                state.frameworks.put(framework.name(), new RunReport.FrameworkStatus(
                    framework.name(), framework.version(), transaction.stateOf(framework.name()), null));
            }
            return validated;
        } catch (FrameworkValidationException e) {
            for (FrameworkRef ref : request.frameworks()) {
                state.frameworks.put(ref.name(), new RunReport.FrameworkStatus(
                    ref.name(), null, transaction.stateOf(ref.name()), null));
            }
            RollbackGuidance guidance = e.getGuidance();
            state.guidance = guidance;
            state.failureReason = "Framework validation failed: " + String.join(", ", guidance.failedFrameworkNames());
            state.remediation = guidance.render();
            log.error("Run {} aborted before analysis: {}", request.runId(), state.failureReason);
            return null;
        }
    }

    /**
     * 프레임워크별 Coherence 검증.
     *
     * @return 모두 통과하면 true (실패 시 state에 원인 기록)
     */
    private boolean checkCoherence(RunRequest request, RunContext context, RunState state,
                                   List<ValidatedFramework> frameworks) {
        List<String> failures = new ArrayList<>();
        for (ValidatedFramework framework : frameworks) {
            context.checkCancelled();
            CoherenceValidation result;
            try {
                result = coherenceValidator.validate(context, framework, request.experiment(), request.corpus(), models);
            } catch (ProviderException | ProviderExhaustedException | CircuitOpenException e) {
                state.failureReason = "Coherence validation of " + framework.name() + " could not run: " + e.getMessage();
                state.remediation = "Check provider health and credentials, then rerun";
                log.error("Run {} aborted: {}", request.runId(), state.failureReason);
                return false;
            }

            RunReport.FrameworkStatus status = state.frameworks.get(framework.name());
            state.frameworks.put(framework.name(), new RunReport.FrameworkStatus(
                status.name(), status.version(), status.state(), result.success()));

            if (!result.success()) {
                CoherenceValidationException failure = new CoherenceValidationException(framework.name(),
                    result.summary() + (result.issues().isEmpty() ? "" : " " + result.issues()));
                log.error("Run {}: {}", request.runId(), failure.getMessage());
                failures.add(failure.getMessage());
            }
        }

        if (failures.isEmpty()) {
            return true;
        }
        state.failureReason = String.join("; ", failures);
        state.remediation = "Fix the reported issues, then clear cached failures with 'cache --cleanup-failed'";
        return false;
    }

    /**
     * 문서 분석 (worker pool).
     *
     * <p>모든 문서의 결과가 확정될 때까지 기다립니다. 실패율이 임계값을 넘으면
     * 아직 시작하지 않은 문서는 호출 없이 건너뜁니다.</p>
     */
    private List<DocumentOutcome> analyzeDocuments(RunRequest request, RunContext context,
                                                   List<ValidatedFramework> frameworks) {
        int total = request.documents().size();
        AtomicInteger failed = new AtomicInteger();
        AtomicBoolean halted = new AtomicBoolean(false);

        List<Future<DocumentOutcome>> futures = new ArrayList<>(total);
        for (Document document : request.documents()) {
            futures.add(workerExecutor.submit(() -> {
                DocumentOutcome outcome = analyzeOne(request.runId(), context, halted, document, frameworks);
                if (outcome.isFailed() && config.exceedsThreshold(failed.incrementAndGet(), total)) {
                    halted.set(true);
                }
                return outcome;
            }));
        }

        List<DocumentOutcome> outcomes = new ArrayList<>(total);
        for (int i = 0; i < futures.size(); i++) {
            Document document = request.documents().get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                futures.forEach(future -> future.cancel(true));
                throw new RunCancelledException(request.runId());
            } catch (ExecutionException e) {
                outcomes.add(recordFailure(request.runId(), Failed.of(document.name(), DocumentFailureKind.INTERNAL_ERROR,
                    String.valueOf(e.getCause()))));
            }
        }

        log.info("Run {} analysis finished: {} analyzed, {} failed", request.runId(),
            outcomes.stream().filter(DocumentOutcome::isAnalyzed).count(),
            outcomes.stream().filter(DocumentOutcome::isFailed).count());
        return outcomes;
    }

    private DocumentOutcome analyzeOne(RunId runId, RunContext context, AtomicBoolean halted, Document document,
                                       List<ValidatedFramework> frameworks) {
        if (context.isCancelled()) {
            return recordFailure(runId, Failed.of(document.name(), DocumentFailureKind.CANCELLED,
                "Run was cancelled before analysis started"));
        }
        if (halted.get()) {
            return recordFailure(runId, Failed.of(document.name(), DocumentFailureKind.CANCELLED,
                "Skipped after the failure threshold was exceeded"));
        }
        try {
            return documentAnalyzer.analyze(runId, document, frameworks, models);
        } catch (RuntimeException e) {
            DocumentAnalysisException failure = new DocumentAnalysisException(document.name(),
                "Analysis of " + document.name() + " failed: " + e.getMessage(), e);
            log.warn(failure.getMessage(), failure);
            return recordFailure(runId, Failed.of(document.name(), DocumentFailureKind.INTERNAL_ERROR,
                String.valueOf(e.getMessage())));
        }
    }

    private DocumentOutcome recordFailure(RunId runId, Failed failed) {
        auditLog.append(new AuditEvent(runId, Phase.ANALYSIS, AuditEventType.DOCUMENT_FAILED,
            failed.rawResponseRef(), failed.documentName() + " " + failed.kind() + ": " + failed.message(), clock.instant()));
        return failed;
    }

    private void startPhase(RunContext context, RunStatus status, Phase phase) {
        context.transitionTo(status);
        context.startPhase(phase);
        audit(context, phase, AuditEventType.PHASE_STARTED, null, phase.name());
        log.info("Run {} phase {} started", context.runId(), phase);
    }

    private void endPhase(RunContext context) {
        PhaseTiming timing = context.finishPhase();
        if (timing != null) {
            audit(context, timing.phase(), AuditEventType.PHASE_COMPLETED, null,
                timing.duration().toMillis() + "ms, cache " + timing.cacheHits() + "/" + timing.cacheMisses());
            log.info("Run {} phase {} completed in {}ms (cache hits: {}, misses: {})", context.runId(), timing.phase(),
                timing.duration().toMillis(), timing.cacheHits(), timing.cacheMisses());
        }
    }

    private void store(RunContext context, RunState state, String name, AuditEventType type, Object value, String detail) {
        ContentHash ref = artifactStore.put(JsonCodec.write(value));
        audit(context, context.currentPhase(), type, ref, detail);
        state.artifacts.put(name, ref);
    }

    /**
     * Run 종료: 진행 중인 단계 마감 → 상태 전이 → Run 기록 저장 → 감사 이벤트 → 보고서.
     */
    private RunReport finish(RunContext context, RunState state, RunStatus terminal, String reason, String remediation) {
        Phase lastPhase = context.currentPhase() != null ? context.currentPhase() : lastRecordedPhase(context);
        endPhase(context);
        context.transitionTo(terminal);

        List<PhaseTiming> timings = context.timings();
        long hits = context.totalCacheHits();
        long misses = context.totalCacheMisses();

        RunReport report = new RunReport(
            context.runId(),
            terminal,
            context.startedAt(),
            context.now(),
            timings,
            hits,
            misses,
            new ArrayList<>(state.frameworks.values()),
            state.documents,
            reason,
            remediation,
            state.guidance,
            state.verification,
            state.synthesis,
            state.artifacts,
            PerformanceScore.calculate(timings, hits, misses)
        );

        // 저장소 장애로 종료 보고가 막히지 않도록 Run 기록과 종료 감사는 실패해도 계속 진행
        ContentHash recordRef = null;
        try {
            recordRef = artifactStore.put(JsonCodec.write(RunRecord.from(report)));
        } catch (RuntimeException e) {
            log.error("Run record for {} could not be stored, reporting without it", context.runId(), e);
        }
        AuditEventType type = terminal == RunStatus.COMPLETED ? AuditEventType.RUN_COMPLETED : AuditEventType.RUN_ABORTED;
        try {
            audit(context, lastPhase, type, recordRef, terminal + (reason == null ? "" : ": " + reason));
        } catch (RuntimeException e) {
            log.error("Terminal audit event for {} could not be appended", context.runId(), e);
        }

        Map<String, ContentHash> artifacts = new LinkedHashMap<>(state.artifacts);
        if (recordRef != null) {
            artifacts.put("run-record", recordRef);
        }
        RunReport finalReport = new RunReport(report.runId(), report.status(), report.startedAt(), report.finishedAt(),
            report.phases(), report.cacheHits(), report.cacheMisses(), report.frameworks(), report.documents(),
            report.failureReason(), report.remediation(), report.guidance(), report.verification(), report.synthesis(),
            artifacts, report.performanceScore());

        if (terminal == RunStatus.COMPLETED) {
            log.info(finalReport.summary());
        } else {
            log.warn(finalReport.summary());
        }
        return finalReport;
    }

    private static Phase lastRecordedPhase(RunContext context) {
        List<PhaseTiming> timings = context.timings();
        return timings.isEmpty() ? Phase.VALIDATION : timings.get(timings.size() - 1).phase();
    }

    private void audit(RunContext context, Phase phase, AuditEventType type, ContentHash payload, String detail) {
        auditLog.append(new AuditEvent(context.runId(), phase, type, payload, detail, clock.instant()));
    }

    /**
     * 진행 중인 Run 수.
     */
    public int activeRunCount() {
        return activeRuns.size();
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 분석이 완료되도록 대기합니다.</p>
     */
    @Override
    public void close() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run 하나 동안 쌓이는 결과. 오케스트레이션 스레드만 접근합니다.
     */
    private static final class RunState {
        private final Map<String, RunReport.FrameworkStatus> frameworks = new LinkedHashMap<>();
        private final List<DocumentOutcome> documents = new ArrayList<>();
        private final Map<String, ContentHash> artifacts = new LinkedHashMap<>();
        private RollbackGuidance guidance;
        private SynthesisResult synthesis;
        private VerificationReport verification;
        private String failureReason;
        private String remediation;
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "analysis-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
