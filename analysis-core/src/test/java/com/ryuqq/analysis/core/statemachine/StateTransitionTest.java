package com.ryuqq.analysis.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>프레임워크 검증: UNVALIDATED → VALID → COMMITTED, 실패 상태 → ROLLED_BACK</li>
 *   <li>실행 상태: CREATED → ... → COMPLETED, 어느 비종료 상태에서든 ABORTED/CANCELLED</li>
 *   <li>종료 상태에서의 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 프레임워크 검증 정상 전이 ==========

    @Test
    void transition_UnvalidatedToValidToCommitted_Succeeds() {
        // Given
        FrameworkValidationState state = FrameworkValidationState.UNVALIDATED;

        // When
        state = StateTransition.transition(state, FrameworkValidationState.VALID);
        state = StateTransition.transition(state, FrameworkValidationState.COMMITTED);

        // Then
        assertEquals(FrameworkValidationState.COMMITTED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_ContentChangedToValid_Succeeds() {
        FrameworkValidationState state = StateTransition.transition(
            FrameworkValidationState.UNVALIDATED, FrameworkValidationState.CONTENT_CHANGED);

        state = StateTransition.transition(state, FrameworkValidationState.VALID);

        assertEquals(FrameworkValidationState.VALID, state);
    }

    @ParameterizedTest
    @EnumSource(value = FrameworkValidationState.class, names = {"VERSION_MISMATCH", "MISSING", "MALFORMED"})
    void validate_FailureStateToRolledBack_Succeeds(FrameworkValidationState failure) {
        assertTrue(failure.isFailure());
        assertDoesNotThrow(() -> StateTransition.validate(failure, FrameworkValidationState.ROLLED_BACK));
    }

    @Test
    void validate_ValidToRolledBack_Succeeds() {
        // 다른 프레임워크 실패로 인한 롤백
        assertDoesNotThrow(() -> StateTransition.validate(
            FrameworkValidationState.VALID, FrameworkValidationState.ROLLED_BACK));
    }

    // ========== 프레임워크 검증 불법 전이 ==========

    @Test
    void validate_UnvalidatedToCommitted_ThrowsException() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(FrameworkValidationState.UNVALIDATED, FrameworkValidationState.COMMITTED));

        assertTrue(exception.getMessage().contains("UNVALIDATED → COMMITTED"));
    }

    @Test
    void validate_MalformedToValid_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(FrameworkValidationState.MALFORMED, FrameworkValidationState.VALID));
    }

    @Test
    void validate_FromCommitted_ThrowsException() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(FrameworkValidationState.COMMITTED, FrameworkValidationState.ROLLED_BACK));

        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.validate(null, FrameworkValidationState.VALID));
        assertThrows(IllegalArgumentException.class,
            () -> StateTransition.validate(RunStatus.CREATED, null));
    }

    // ========== 실행 상태 전이 ==========

    @Test
    void transition_RunHappyPath_ReachesCompleted() {
        // Given
        RunStatus status = RunStatus.CREATED;

        // When
        status = StateTransition.transition(status, RunStatus.VALIDATING);
        status = StateTransition.transition(status, RunStatus.ANALYZING);
        status = StateTransition.transition(status, RunStatus.CONSOLIDATING);
        status = StateTransition.transition(status, RunStatus.SYNTHESIZING);
        status = StateTransition.transition(status, RunStatus.VERIFYING);
        status = StateTransition.transition(status, RunStatus.COMPLETED);

        // Then
        assertEquals(RunStatus.COMPLETED, status);
        assertTrue(status.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = RunStatus.class, names = {"CREATED", "VALIDATING", "ANALYZING", "CONSOLIDATING", "SYNTHESIZING", "VERIFYING"})
    void validate_AnyActiveStatusToAbortedOrCancelled_Succeeds(RunStatus active) {
        assertDoesNotThrow(() -> StateTransition.validate(active, RunStatus.ABORTED));
        assertDoesNotThrow(() -> StateTransition.validate(active, RunStatus.CANCELLED));
    }

    @Test
    void validate_SkippingPhase_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(RunStatus.VALIDATING, RunStatus.SYNTHESIZING));
        assertThrows(IllegalStateException.class,
            () -> StateTransition.validate(RunStatus.ANALYZING, RunStatus.COMPLETED));
    }

    @ParameterizedTest
    @EnumSource(value = RunStatus.class, names = {"COMPLETED", "ABORTED", "CANCELLED"})
    void validate_FromTerminalRunStatus_ThrowsException(RunStatus terminal) {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(terminal, RunStatus.CANCELLED));
    }
}
