package com.ryuqq.analysis.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>프레임워크 검증 상태와 Run 상태의 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>Run은 단계를 건너뛰거나 되돌아갈 수 없음</li>
 *   <li>COMMITTED는 VALID에서만 도달 가능</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 프레임워크 검증 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(FrameworkValidationState from, FrameworkValidationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case UNVALIDATED -> to != FrameworkValidationState.UNVALIDATED && to != FrameworkValidationState.COMMITTED;
            case CONTENT_CHANGED -> to == FrameworkValidationState.VALID || to == FrameworkValidationState.ROLLED_BACK;
            case VALID -> to.isTerminal();
            case VERSION_MISMATCH, MISSING, MALFORMED -> to == FrameworkValidationState.ROLLED_BACK;
            case COMMITTED, ROLLED_BACK -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid framework state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 프레임워크 검증 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static FrameworkValidationState transition(FrameworkValidationState current, FrameworkValidationState next) {
        validate(current, next);
        return next;
    }

    /**
     * Run 상태 전이가 유효한지 검증.
     *
     * <p>진행 방향으로 바로 다음 단계만 허용하며, 종료 전이 상태에서는 언제든
     * ABORTED 또는 CANCELLED로 전이할 수 있습니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunStatus from, RunStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (to == RunStatus.ABORTED || to == RunStatus.CANCELLED) {
            return;
        }

        boolean valid = switch (from) {
            case CREATED -> to == RunStatus.VALIDATING;
            case VALIDATING -> to == RunStatus.ANALYZING;
            case ANALYZING -> to == RunStatus.CONSOLIDATING;
            case CONSOLIDATING -> to == RunStatus.SYNTHESIZING;
            case SYNTHESIZING -> to == RunStatus.VERIFYING;
            case VERIFYING -> to == RunStatus.COMPLETED;
            case COMPLETED, ABORTED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid run state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Run 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static RunStatus transition(RunStatus current, RunStatus next) {
        validate(current, next);
        return next;
    }
}
