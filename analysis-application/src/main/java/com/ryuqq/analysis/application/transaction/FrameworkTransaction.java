package com.ryuqq.analysis.application.transaction;

import com.ryuqq.analysis.core.exception.ArtifactStoreException;
import com.ryuqq.analysis.core.exception.FrameworkValidationException;
import com.ryuqq.analysis.core.exception.VersionCollisionException;
import com.ryuqq.analysis.core.model.Artifact;
import com.ryuqq.analysis.core.model.AuditEvent;
import com.ryuqq.analysis.core.model.AuditEventType;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.FrameworkFailureKind;
import com.ryuqq.analysis.core.model.FrameworkRef;
import com.ryuqq.analysis.core.model.FrameworkStatus;
import com.ryuqq.analysis.core.model.FrameworkVersion;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RollbackGuidance;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.statemachine.FrameworkValidationState;
import com.ryuqq.analysis.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run 하나의 프레임워크 트랜잭션.
 *
 * <p><strong>검증 알고리즘 ({@link #validate(FrameworkRef)}):</strong></p>
 * <ol>
 *   <li>Registry에서 이름의 행 조회 (Registry가 유일한 기준, 다른 Run의 커밋 전 발급분 제외)</li>
 *   <li>행이 없으면 MISSING (검증 중 암묵적 등록 없음)</li>
 *   <li>고정 버전이 Registry에 없으면 VERSION_MISMATCH</li>
 *   <li>로컬 사본이 없으면 Registry 내용을 읽어 구조 검증 후 VALID</li>
 *   <li>로컬 사본을 읽지 못하면 MISSING, 구조가 잘못되면 MALFORMED</li>
 *   <li>기준 행과 해시가 같으면 VALID</li>
 *   <li>고정 버전과 다르면 VERSION_MISMATCH</li>
 *   <li>최신과 다르면 CONTENT_CHANGED: 같은 내용의 과거 행이 있으면 재사용하고,
 *       없으면 max+1 버전을 발급해 VALID</li>
 * </ol>
 *
 * <p><strong>집계 규칙:</strong> {@link #validateAll(List)}은 모든 참조를 검증한 뒤
 * 하나라도 실패하면 발급한 버전을 역순으로 삭제하고 {@link FrameworkValidationException}을
 * 던집니다. 검증 도중 Registry나 저장소 예외가 나도 먼저 롤백한 뒤 원인을 담아 던지므로,
 * 호출자가 예외를 받을 때 고아 버전은 남아 있지 않습니다.</p>
 *
 * <p>발급했지만 아직 커밋하지 않은 버전은 다른 트랜잭션이 재사용하지 못합니다.
 * 같은 내용을 검증하는 다른 Run은 VERSION_COLLISION으로 실패합니다.</p>
 *
 * <p>한 스레드(Run driver)에서 사용하는 객체이며 스레드 안전하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FrameworkTransaction {

    private static final Logger log = LoggerFactory.getLogger(FrameworkTransaction.class);

    private final RunId runId;
    private final FrameworkTransactionManager manager;

    private final Map<String, FrameworkValidationState> states = new LinkedHashMap<>();
    private final Map<String, FrameworkValidation> results = new LinkedHashMap<>();
    private final List<FrameworkVersion> minted = new ArrayList<>();
    private RollbackGuidance.FailedFramework abortCause;
    private boolean closed;

    FrameworkTransaction(RunId runId, FrameworkTransactionManager manager) {
        this.runId = runId;
        this.manager = manager;
    }

    /**
     * 참조하는 모든 프레임워크 검증 후 커밋.
     *
     * @param refs 프레임워크 참조 목록 (1개 이상)
     * @return 검증된 프레임워크 (참조 순서)
     * @throws FrameworkValidationException 하나라도 실패한 경우 (롤백 완료 후)
     */
    public List<ValidatedFramework> validateAll(List<FrameworkRef> refs) {
        if (refs == null || refs.isEmpty()) {
            throw new IllegalArgumentException("refs cannot be null or empty");
        }

        List<ValidatedFramework> validated = new ArrayList<>();
        for (FrameworkRef ref : refs) {
            FrameworkValidation result;
            try {
                result = validate(ref);
            } catch (RuntimeException e) {
                throw abort(ref, e);
            }
            if (result instanceof FrameworkValidation.Valid valid) {
                validated.add(valid.framework());
            }
        }

        if (validated.size() < refs.size()) {
            RollbackGuidance guidance = rollback();
            log.error("Framework transaction for {} rolled back: {}", runId, guidance.failedFrameworkNames());
            throw new FrameworkValidationException(guidance);
        }

        commit();
        return validated;
    }

    private FrameworkValidationException abort(FrameworkRef ref, RuntimeException cause) {
        log.error("Validation of framework {} for {} aborted, rolling back", ref == null ? null : ref.name(), runId, cause);
        if (ref != null) {
            abortCause = RollbackGuidance.FailedFramework.of(ref.name(), FrameworkFailureKind.VALIDATION_ABORTED,
                "Validation aborted: " + cause.getMessage());
        }
        try {
            return new FrameworkValidationException(rollback(), cause);
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            throw cause;
        }
    }

    /**
     * 프레임워크 하나 검증.
     *
     * @param ref 프레임워크 참조
     * @return Valid 또는 Invalid
     * @throws IllegalStateException 이미 커밋 또는 롤백된 경우
     */
    public FrameworkValidation validate(FrameworkRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        ensureOpen();

        ReentrantLock lock = manager.lockFor(ref.name());
        lock.lock();
        try {
            states.put(ref.name(), FrameworkValidationState.UNVALIDATED);
            FrameworkValidation result = doValidate(ref);
            results.put(ref.name(), result);

            if (result instanceof FrameworkValidation.Valid valid) {
                audit(AuditEventType.FRAMEWORK_VALIDATED, valid.framework().contentHash(),
                    valid.name() + " v" + valid.framework().version());
                log.info("Framework {} validated as version {}{}", valid.name(), valid.framework().version(),
                    valid.framework().minted() ? " (newly minted)" : "");
            } else if (result instanceof FrameworkValidation.Invalid invalid) {
                audit(AuditEventType.FRAMEWORK_REJECTED, null,
                    invalid.name() + " " + invalid.state() + ": " + invalid.detail());
                log.warn("Framework {} failed validation: {} ({})", invalid.name(), invalid.state(), invalid.detail());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private FrameworkValidation doValidate(FrameworkRef ref) {
        String name = ref.name();
        List<FrameworkVersion> versions = manager.visibleVersions(name, runId);
        if (versions.isEmpty()) {
            return invalid(name, FrameworkValidationState.MISSING, FrameworkFailureKind.MISSING_REGISTRY,
                "No registry entry for framework '" + name + "'");
        }

        FrameworkVersion latest = versions.get(versions.size() - 1);
        FrameworkVersion reference = latest;
        if (ref.isPinned()) {
            Optional<FrameworkVersion> pinned = versions.stream()
                .filter(version -> version.version() == ref.expectedVersion())
                .findFirst();
            if (pinned.isEmpty()) {
                return invalid(name, FrameworkValidationState.VERSION_MISMATCH, FrameworkFailureKind.VERSION_MISMATCH,
                    "Version " + ref.expectedVersion() + " is not registered (latest: " + latest.version() + ")");
            }
            reference = pinned.get();
        }

        if (!ref.hasLocalCopy()) {
            return validateRegistryContent(name, reference);
        }

        byte[] content;
        try {
            content = ref.localCopy().read();
        } catch (IOException | RuntimeException e) {
            return invalid(name, FrameworkValidationState.MISSING, FrameworkFailureKind.UNREADABLE_LOCAL_COPY,
                "Local copy could not be read: " + e.getMessage());
        }

        FrameworkDefinition definition;
        try {
            definition = manager.parser().parse(content);
        } catch (MalformedFrameworkException e) {
            return invalid(name, FrameworkValidationState.MALFORMED, FrameworkFailureKind.MALFORMED, e.getMessage());
        }

        ContentHash hash = ContentHash.digest(content);
        if (hash.equals(reference.contentHash())) {
            transition(name, FrameworkValidationState.VALID);
            return valid(reference, content, definition, false);
        }

        if (ref.isPinned()) {
            return invalid(name, FrameworkValidationState.VERSION_MISMATCH, FrameworkFailureKind.VERSION_MISMATCH,
                "Local copy differs from pinned version " + reference.version());
        }

        transition(name, FrameworkValidationState.CONTENT_CHANGED);
        return resolveContentChange(name, hash, content, definition);
    }

    private FrameworkValidation validateRegistryContent(String name, FrameworkVersion reference) {
        Optional<Artifact> artifact = manager.artifactStore().find(reference.contentHash());
        if (artifact.isEmpty()) {
            return invalid(name, FrameworkValidationState.MISSING, FrameworkFailureKind.MISSING_REGISTRY,
                "Content of version " + reference.version() + " is missing from the artifact store");
        }
        byte[] content = artifact.get().getBytes();
        try {
            FrameworkDefinition definition = manager.parser().parse(content);
            transition(name, FrameworkValidationState.VALID);
            return valid(reference, content, definition, false);
        } catch (MalformedFrameworkException e) {
            return invalid(name, FrameworkValidationState.MALFORMED, FrameworkFailureKind.MALFORMED,
                "Registered version " + reference.version() + " is malformed: " + e.getMessage());
        }
    }

    private FrameworkValidation resolveContentChange(String name, ContentHash hash, byte[] content, FrameworkDefinition definition) {
        try {
            Optional<FrameworkVersion> earlier = manager.findByHash(name, hash, runId);
            if (earlier.isPresent()) {
                log.info("Local copy of {} matches earlier version {}, reusing it", name, earlier.get().version());
                transition(name, FrameworkValidationState.VALID);
                return valid(earlier.get(), content, definition, false);
            }

            manager.artifactStore().put(content);
            FrameworkTransactionManager.MintResult result = manager.insertNextVersion(name, hash, FrameworkStatus.DRAFT,
                runId, candidate -> audit(AuditEventType.FRAMEWORK_VERSION_MINTING, hash,
                    candidate.name() + " v" + candidate.version()));
            if (result.created()) {
                minted.add(result.version());
            }
            transition(name, FrameworkValidationState.VALID);
            return valid(result.version(), content, definition, result.created());
        } catch (VersionCollisionException e) {
            return invalid(name, FrameworkValidationState.CONTENT_CHANGED, FrameworkFailureKind.VERSION_COLLISION,
                e.getMessage());
        } catch (ArtifactStoreException e) {
            return invalid(name, FrameworkValidationState.CONTENT_CHANGED, FrameworkFailureKind.CONTENT_MISMATCH_UNRESOLVED,
                "Changed content could not be stored: " + e.getMessage());
        }
    }

    /**
     * 트랜잭션 커밋.
     *
     * @throws IllegalStateException 실패한 프레임워크가 있거나 이미 종료된 경우
     */
    public void commit() {
        ensureOpen();
        if (results.values().stream().anyMatch(result -> !result.isValid())) {
            throw new IllegalStateException("Cannot commit a transaction with failed frameworks: " + failedNames());
        }
        for (String name : states.keySet()) {
            audit(AuditEventType.FRAMEWORK_COMMITTED, null, name);
            transition(name, FrameworkValidationState.COMMITTED);
        }
        manager.release(minted);
        closed = true;
        log.info("Framework transaction for {} committed: {} framework(s), {} new version(s)",
            runId, states.size(), minted.size());
    }

    /**
     * 트랜잭션 롤백.
     *
     * <p>이 트랜잭션이 발급한 버전을 발급 역순으로 삭제합니다. 각 삭제 전에
     * 감사 이벤트를 남깁니다.</p>
     *
     * @return 롤백 안내
     * @throws IllegalStateException 이미 종료된 경우
     */
    public RollbackGuidance rollback() {
        ensureOpen();
        List<FrameworkVersion> reverted = new ArrayList<>();
        try {
            for (int i = minted.size() - 1; i >= 0; i--) {
                FrameworkVersion version = minted.get(i);
                audit(AuditEventType.FRAMEWORK_VERSION_ROLLED_BACK, version.contentHash(),
                    version.name() + " v" + version.version());
                if (manager.registry().delete(version.name(), version.version())) {
                    reverted.add(version);
                    log.info("Rolled back framework version {} v{}", version.name(), version.version());
                } else {
                    log.warn("Framework version {} v{} was already absent during rollback", version.name(), version.version());
                }
            }
        } finally {
            manager.release(minted);
            closed = true;
        }
        for (String name : states.keySet()) {
            transition(name, FrameworkValidationState.ROLLED_BACK);
        }
        return new RollbackGuidance(failuresOrTransactionAbort(), reverted);
    }

    /**
     * 현재 실패 목록으로 만든 롤백 안내 (롤백은 수행하지 않음).
     *
     * @return 실패가 있으면 안내, 없으면 empty
     */
    public Optional<RollbackGuidance> guidance() {
        List<RollbackGuidance.FailedFramework> failures = failures();
        return failures.isEmpty() ? Optional.empty() : Optional.of(new RollbackGuidance(failures, List.of()));
    }

    /**
     * 프레임워크 상태 조회.
     *
     * @param name 프레임워크 이름
     * @return 상태 (검증하지 않은 이름이면 UNVALIDATED)
     */
    public FrameworkValidationState stateOf(String name) {
        return states.getOrDefault(name, FrameworkValidationState.UNVALIDATED);
    }

    /**
     * 이번 트랜잭션이 발급한 버전 (발급 순서).
     */
    public List<FrameworkVersion> mintedVersions() {
        return Collections.unmodifiableList(minted);
    }

    public RunId getRunId() {
        return runId;
    }

    public boolean isClosed() {
        return closed;
    }

    private List<RollbackGuidance.FailedFramework> failures() {
        List<RollbackGuidance.FailedFramework> failures = new ArrayList<>();
        for (FrameworkValidation result : results.values()) {
            if (result instanceof FrameworkValidation.Invalid invalid) {
                failures.add(RollbackGuidance.FailedFramework.of(invalid.name(), invalid.kind(), invalid.detail()));
            }
        }
        return failures;
    }

    private List<RollbackGuidance.FailedFramework> failuresOrTransactionAbort() {
        List<RollbackGuidance.FailedFramework> failures = failures();
        if (abortCause != null) {
            failures.add(abortCause);
        }
        if (!failures.isEmpty()) {
            return failures;
        }
        // 검증은 모두 통과했지만 호출자가 명시적으로 롤백한 경우
        List<RollbackGuidance.FailedFramework> aborted = new ArrayList<>();
        for (String name : states.keySet()) {
            aborted.add(new RollbackGuidance.FailedFramework(name, FrameworkFailureKind.CONTENT_MISMATCH_UNRESOLVED,
                "Transaction rolled back by caller", "Rerun the experiment once the aborting condition is resolved"));
        }
        if (aborted.isEmpty()) {
            throw new IllegalStateException("Cannot roll back an empty transaction");
        }
        return aborted;
    }

    private List<String> failedNames() {
        return failures().stream().map(RollbackGuidance.FailedFramework::name).toList();
    }

    private FrameworkValidation valid(FrameworkVersion version, byte[] content, FrameworkDefinition definition, boolean mintedNow) {
        return new FrameworkValidation.Valid(new ValidatedFramework(
            version.name(), version.version(), version.contentHash(), content, definition, mintedNow));
    }

    private FrameworkValidation invalid(String name, FrameworkValidationState state, FrameworkFailureKind kind, String detail) {
        if (stateOf(name) != state) {
            transition(name, state);
        }
        return new FrameworkValidation.Invalid(name, state, kind, detail);
    }

    private void transition(String name, FrameworkValidationState next) {
        states.put(name, StateTransition.transition(stateOf(name), next));
    }

    private void audit(AuditEventType type, ContentHash payloadHash, String detail) {
        manager.auditLog().append(new AuditEvent(runId, Phase.VALIDATION, type, payloadHash, detail, manager.clock().instant()));
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Framework transaction for " + runId + " is already closed");
        }
    }
}
