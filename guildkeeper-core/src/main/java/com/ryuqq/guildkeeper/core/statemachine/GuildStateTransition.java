package com.ryuqq.guildkeeper.core.statemachine;

/**
 * 길드 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNKNOWN → TRACKED</li>
 *   <li>UNKNOWN → REMOVED</li>
 *   <li>TRACKED → REMOVED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(REMOVED)에서는 어떤 상태로도 전이 불가 (재참여는 새 회차)</li>
 *   <li>동일 상태로의 전이는 전이가 아님 (중복 이벤트는 호출 측에서 걸러냄)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuildStateTransition {

    // Utility class - prevent instantiation
    private GuildStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(GuildState from, GuildState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case UNKNOWN -> to == GuildState.TRACKED || to == GuildState.REMOVED;
            case TRACKED -> to == GuildState.REMOVED;
            case REMOVED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static GuildState transition(GuildState current, GuildState next) {
        validate(current, next);
        return next;
    }
}
