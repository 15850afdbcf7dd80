package com.ryuqq.guildkeeper.core.spi;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.UserId;

/**
 * Narrow permission capability.
 *
 * <p>Keeps the command validation logic independent of a live platform
 * connection. A platform-backed implementation resolves the member and checks
 * the administrator permission bit.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PermissionOracle {

    /**
     * Checks whether the user holds administrator-equivalent permission in the guild.
     *
     * @param guildId the guild
     * @param userId the user
     * @return true if the user is an administrator of the guild
     */
    boolean isAdministrator(GuildId guildId, UserId userId);
}
