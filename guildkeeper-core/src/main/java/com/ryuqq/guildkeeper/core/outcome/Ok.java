package com.ryuqq.guildkeeper.core.outcome;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * 성공 결과.
 *
 * @param guildId 처리된 길드
 * @param message 결과 메시지 (명령어의 경우 응답 본문)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    GuildId guildId,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException guildId 또는 message가 null인 경우
     */
    public Ok {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    public static Ok of(GuildId guildId, String message) {
        return new Ok(guildId, message);
    }
}
