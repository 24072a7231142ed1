package com.ryuqq.analysis.application.transaction;

import com.ryuqq.analysis.core.exception.VersionCollisionException;
import com.ryuqq.analysis.core.model.ContentHash;
import com.ryuqq.analysis.core.model.FrameworkStatus;
import com.ryuqq.analysis.core.model.FrameworkVersion;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import com.ryuqq.analysis.core.spi.AuditLog;
import com.ryuqq.analysis.core.spi.FrameworkRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Framework Transaction Manager.
 *
 * <p>FrameworkVersion 행의 유일한 writer입니다. Run마다 {@link FrameworkTransaction}을 열어
 * 참조하는 모든 프레임워크를 검증하고, 하나라도 실패하면 그 트랜잭션이 발급한 버전을
 * 모두 되돌립니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>같은 이름의 버전 발급은 이름별 잠금으로 직렬화 (프로세스 내)</li>
 *   <li>커밋 전 발급 버전은 발급한 Run만 사용 (다른 Run은 충돌로 처리)</li>
 *   <li>프로세스 간 경합은 Registry 유일성 제약과 충돌 재시도로 해결</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FrameworkTransactionManager {

    private static final Logger log = LoggerFactory.getLogger(FrameworkTransactionManager.class);

    /**
     * 버전 발급 충돌 시 최대 시도 횟수 (기본값).
     */
    public static final int DEFAULT_MAX_MINT_ATTEMPTS = 5;

    private final FrameworkRegistry registry;
    private final ArtifactStore artifactStore;
    private final AuditLog auditLog;
    private final FrameworkDefinitionParser parser;
    private final Clock clock;
    private final int maxMintAttempts;

    private final ConcurrentHashMap<String, ReentrantLock> nameLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PendingKey, RunId> pendingMints = new ConcurrentHashMap<>();

    public FrameworkTransactionManager(FrameworkRegistry registry, ArtifactStore artifactStore, AuditLog auditLog, Clock clock) {
        this(registry, artifactStore, auditLog, new FrameworkDefinitionParser(), clock, DEFAULT_MAX_MINT_ATTEMPTS);
    }

    /**
     * 생성자.
     *
     * @param registry 프레임워크 Registry
     * @param artifactStore 프레임워크 내용 저장소
     * @param auditLog 감사 로그
     * @param parser 정의 파서
     * @param clock 시계
     * @param maxMintAttempts 버전 발급 최대 시도 횟수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FrameworkTransactionManager(
        FrameworkRegistry registry,
        ArtifactStore artifactStore,
        AuditLog auditLog,
        FrameworkDefinitionParser parser,
        Clock clock,
        int maxMintAttempts
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (maxMintAttempts <= 0) {
            throw new IllegalArgumentException("maxMintAttempts must be positive (current: " + maxMintAttempts + ")");
        }
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.auditLog = auditLog;
        this.parser = parser;
        this.clock = clock;
        this.maxMintAttempts = maxMintAttempts;
    }

    /**
     * Run 하나의 트랜잭션 시작.
     *
     * @param runId Run ID
     * @return 새 트랜잭션
     */
    public FrameworkTransaction begin(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return new FrameworkTransaction(runId, this);
    }

    /**
     * 프레임워크 명시적 등록.
     *
     * <p>처음 보는 프레임워크의 첫 버전을 만드는 유일한 경로입니다. 검증 중에는
     * Registry에 없는 프레임워크를 암묵적으로 등록하지 않습니다.</p>
     *
     * <p>같은 내용이 이미 등록되어 있으면 기존 행을 반환합니다.</p>
     *
     * @param name 프레임워크 이름
     * @param content 프레임워크 내용
     * @return 등록된 (또는 기존) 버전
     * @throws MalformedFrameworkException 내용이 잘못된 경우
     * @throws VersionCollisionException 충돌 재시도를 모두 소진한 경우
     */
    public FrameworkVersion importFramework(String name, byte[] content) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        parser.parse(content);

        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            ContentHash hash = artifactStore.put(content);
            Optional<FrameworkVersion> existing = findByHash(name, hash, null);
            if (existing.isPresent()) {
                log.info("Framework {} already registered as version {}", name, existing.get().version());
                return existing.get();
            }
            FrameworkVersion imported = insertNextVersion(name, hash, FrameworkStatus.ACTIVE, null, version -> { }).version();
            log.info("Framework {} imported as version {} ({})", name, imported.version(), hash);
            return imported;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 버전 번호로 낙관적 삽입.
     *
     * <p>충돌하면 Registry를 다시 읽어 다음 번호로 재시도합니다. 다른 writer가 같은 내용을
     * 먼저 등록했다면 그 행을 반환합니다.</p>
     *
     * @param owner 커밋 전까지 행을 점유할 Run (명시적 import는 null)
     * @param beforeInsert 삽입 직전에 호출 (감사 이벤트 기록용)
     * @return 삽입된 행 또는 같은 내용의 기존 행, 그리고 이번 호출이 삽입했는지 여부
     * @throws VersionCollisionException 최대 시도 횟수 초과 또는 같은 내용이 다른 Run에 점유된 경우
     */
    MintResult insertNextVersion(String name, ContentHash hash, FrameworkStatus status, RunId owner,
                                 Consumer<FrameworkVersion> beforeInsert) {
        VersionCollisionException lastCollision = null;
        for (int attempt = 1; attempt <= maxMintAttempts; attempt++) {
            List<FrameworkVersion> versions = registry.findVersions(name);
            Optional<FrameworkVersion> sameContent = visibleMatch(versions, hash, owner);
            if (sameContent.isPresent()) {
                return new MintResult(sameContent.get(), false);
            }

            int next = versions.stream().mapToInt(FrameworkVersion::version).max().orElse(0) + 1;
            FrameworkVersion candidate = new FrameworkVersion(name, next, hash, status, clock.instant());
            beforeInsert.accept(candidate);
            try {
                registry.insert(candidate);
                if (owner != null) {
                    pendingMints.put(PendingKey.of(candidate), owner);
                }
                return new MintResult(candidate, true);
            } catch (VersionCollisionException e) {
                lastCollision = e;
                log.warn("Version collision for {} v{} (attempt {}/{}): {}",
                    name, next, attempt, maxMintAttempts, e.getMessage());
            }
        }
        throw new VersionCollisionException(name, lastCollision == null ? 0 : lastCollision.getVersion(),
            "Could not mint a version of '" + name + "' after " + maxMintAttempts + " attempts");
    }

    /**
     * 버전 발급 결과.
     *
     * @param version 사용할 행
     * @param created 이번 호출이 삽입한 행인지 여부
     */
    record MintResult(FrameworkVersion version, boolean created) {
    }

    /**
     * Run이 볼 수 있는 행 조회.
     *
     * @param requester 조회하는 Run
     * @return 다른 Run의 커밋 전 발급분을 제외한 행 (버전 오름차순)
     */
    List<FrameworkVersion> visibleVersions(String name, RunId requester) {
        return registry.findVersions(name).stream()
            .filter(version -> {
                RunId owner = pendingMints.get(PendingKey.of(version));
                return owner == null || owner.equals(requester);
            })
            .toList();
    }

    /**
     * 같은 내용의 행 조회.
     *
     * @param requester 조회하는 Run (명시적 import는 null)
     * @throws VersionCollisionException 같은 내용의 행이 다른 Run의 커밋 전 발급분인 경우
     */
    Optional<FrameworkVersion> findByHash(String name, ContentHash hash, RunId requester) {
        return visibleMatch(registry.findVersions(name), hash, requester);
    }

    private Optional<FrameworkVersion> visibleMatch(List<FrameworkVersion> versions, ContentHash hash, RunId requester) {
        Optional<FrameworkVersion> match = versions.stream()
            .filter(version -> version.contentHash().equals(hash))
            .findFirst();
        if (match.isPresent()) {
            RunId owner = pendingMints.get(PendingKey.of(match.get()));
            if (owner != null && !owner.equals(requester)) {
                throw new VersionCollisionException(match.get().name(), match.get().version(),
                    "Version " + match.get().version() + " of '" + match.get().name()
                        + "' is not committed yet (minted by " + owner + ")");
            }
        }
        return match;
    }

    /**
     * 트랜잭션 종료 시 점유 해제.
     *
     * @param versions 트랜잭션이 발급한 버전
     */
    void release(Collection<FrameworkVersion> versions) {
        for (FrameworkVersion version : versions) {
            pendingMints.remove(PendingKey.of(version));
        }
    }

    private record PendingKey(String name, int version) {

        static PendingKey of(FrameworkVersion version) {
            return new PendingKey(version.name(), version.version());
        }
    }

    ReentrantLock lockFor(String name) {
        return nameLocks.computeIfAbsent(name, key -> new ReentrantLock());
    }

    FrameworkRegistry registry() {
        return registry;
    }

    ArtifactStore artifactStore() {
        return artifactStore;
    }

    AuditLog auditLog() {
        return auditLog;
    }

    FrameworkDefinitionParser parser() {
        return parser;
    }

    Clock clock() {
        return clock;
    }
}
