package com.ryuqq.guildkeeper.core.contract;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * 길드 이탈 이벤트.
 *
 * @param guildId 길드 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GuildLeft(GuildId guildId) implements LifecycleEvent {

    public GuildLeft {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
    }
}
