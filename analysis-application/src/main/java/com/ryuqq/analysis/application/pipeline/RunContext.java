package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.exception.RunCancelledException;
import com.ryuqq.analysis.core.model.Phase;
import com.ryuqq.analysis.core.model.RunId;
import com.ryuqq.analysis.core.statemachine.RunStatus;
import com.ryuqq.analysis.core.statemachine.StateTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run 하나의 실행 상태.
 *
 * <p>Run마다 새로 생성되며 Run 간에 공유되지 않습니다. 취소 플래그와 캐시 카운터는
 * 분석 worker 스레드에서도 접근하므로 atomic으로 관리하고, 상태와 단계 기록은
 * 오케스트레이션 스레드만 변경합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunContext {

    private final RunId runId;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger phaseHits = new AtomicInteger();
    private final AtomicInteger phaseMisses = new AtomicInteger();
    private final List<PhaseTiming> timings = new ArrayList<>();

    private volatile RunStatus status = RunStatus.CREATED;
    private Phase currentPhase;
    private Instant currentPhaseStartedAt;

    public RunContext(RunId runId, Clock clock) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.runId = runId;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * 상태 전이 (StateTransition 규칙 검증).
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public void transitionTo(RunStatus next) {
        this.status = StateTransition.transition(status, next);
    }

    /**
     * 단계 시작. 이전 단계가 끝나지 않았으면 예외.
     */
    public void startPhase(Phase phase) {
        if (currentPhase != null) {
            throw new IllegalStateException("Phase " + currentPhase + " is still running");
        }
        this.currentPhase = phase;
        this.currentPhaseStartedAt = clock.instant();
        phaseHits.set(0);
        phaseMisses.set(0);
    }

    /**
     * 진행 중인 단계 종료 및 기록.
     *
     * @return 기록된 단계 정보 (진행 중인 단계가 없으면 null)
     */
    public PhaseTiming finishPhase() {
        if (currentPhase == null) {
            return null;
        }
        PhaseTiming timing = new PhaseTiming(currentPhase, currentPhaseStartedAt, clock.instant(),
            phaseHits.get(), phaseMisses.get());
        timings.add(timing);
        currentPhase = null;
        currentPhaseStartedAt = null;
        return timing;
    }

    public void recordCacheHit() {
        phaseHits.incrementAndGet();
    }

    public void recordCacheMiss() {
        phaseMisses.incrementAndGet();
    }

    /**
     * 협조적 취소 요청. 진행 중인 호출은 deadline까지 계속됩니다.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * 취소 확인 지점 (문서 사이, 단계 사이).
     *
     * @throws RunCancelledException 취소된 경우
     */
    public void checkCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(runId);
        }
    }

    public long totalCacheHits() {
        return timings.stream().mapToLong(PhaseTiming::cacheHits).sum();
    }

    public long totalCacheMisses() {
        return timings.stream().mapToLong(PhaseTiming::cacheMisses).sum();
    }

    public List<PhaseTiming> timings() {
        return List.copyOf(timings);
    }

    public Phase currentPhase() {
        return currentPhase;
    }

    public RunStatus status() {
        return status;
    }

    public RunId runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant now() {
        return clock.instant();
    }
}
