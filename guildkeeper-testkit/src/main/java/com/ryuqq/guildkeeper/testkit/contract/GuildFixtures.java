package com.ryuqq.guildkeeper.testkit.contract;

import com.ryuqq.guildkeeper.core.contract.GuildJoined;
import com.ryuqq.guildkeeper.core.contract.GuildLeft;
import com.ryuqq.guildkeeper.core.contract.Invocation;
import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.UserId;

/**
 * Shared identifiers and event factories for tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuildFixtures {

    public static final GuildId GUILD_123 = GuildId.of(123L);
    public static final GuildId GUILD_456 = GuildId.of(456L);
    public static final GuildId GUILD_789 = GuildId.of(789L);

    public static final UserId OWNER_42 = UserId.of(42L);
    public static final UserId OWNER_7 = UserId.of(7L);
    public static final UserId ADMIN_1 = UserId.of(1L);
    public static final UserId MEMBER_99 = UserId.of(99L);

    public static final long CHANNEL_10 = 10L;

    private GuildFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static GuildJoined joined(GuildId guildId, UserId ownerId) {
        return new GuildJoined(guildId, ownerId, 25, "guild-" + guildId.getValue());
    }

    public static GuildLeft left(GuildId guildId) {
        return new GuildLeft(guildId);
    }

    public static Invocation prefixCommand(GuildId guildId, UserId invoker, String rawArgs) {
        return Invocation.inGuild(guildId, CHANNEL_10, invoker, rawArgs);
    }

    public static Invocation prefixCommandInDm(UserId invoker, String rawArgs) {
        return Invocation.directMessage(CHANNEL_10, invoker, rawArgs);
    }
}
