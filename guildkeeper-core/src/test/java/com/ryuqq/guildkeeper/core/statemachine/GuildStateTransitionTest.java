package com.ryuqq.guildkeeper.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.guildkeeper.core.statemachine.GuildState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * GuildStateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (UNKNOWN → TRACKED → REMOVED) 성공</li>
 *   <li>UNKNOWN → REMOVED 정리 전이 성공</li>
 *   <li>REMOVED에서의 모든 전이는 IllegalStateException</li>
 *   <li>TRACKED → UNKNOWN 역방향 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GuildStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_JoinThenLeave_EndsRemoved() {
        // Given
        GuildState state = UNKNOWN;

        // When
        state = GuildStateTransition.transition(state, TRACKED);
        state = GuildStateTransition.transition(state, REMOVED);

        // Then
        assertEquals(REMOVED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_UnknownToRemoved_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> GuildStateTransition.validate(UNKNOWN, REMOVED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_RemovedToTracked_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> GuildStateTransition.validate(REMOVED, TRACKED)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
        assertTrue(exception.getMessage().contains("REMOVED"));
    }

    @Test
    void validate_TrackedToUnknown_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> GuildStateTransition.validate(TRACKED, UNKNOWN)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_TrackedToTracked_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> GuildStateTransition.validate(TRACKED, TRACKED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> GuildStateTransition.validate(null, TRACKED));
        assertThrows(IllegalArgumentException.class, () -> GuildStateTransition.validate(UNKNOWN, null));
    }

    @Test
    void isTerminal_OnlyRemoved() {
        // When & Then
        assertFalse(UNKNOWN.isTerminal());
        assertFalse(TRACKED.isTerminal());
        assertTrue(REMOVED.isTerminal());
    }
}
