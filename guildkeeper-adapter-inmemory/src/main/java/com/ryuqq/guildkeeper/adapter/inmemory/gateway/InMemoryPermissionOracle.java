package com.ryuqq.guildkeeper.adapter.inmemory.gateway;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.UserId;
import com.ryuqq.guildkeeper.core.spi.PermissionOracle;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link PermissionOracle} backed by an explicit grant set.
 *
 * <p>Nobody is an administrator until {@link #grantAdministrator} is called.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryPermissionOracle implements PermissionOracle {

    private final Set<Grant> administrators = ConcurrentHashMap.newKeySet();

    private record Grant(GuildId guildId, UserId userId) {
    }

    @Override
    public boolean isAdministrator(GuildId guildId, UserId userId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        return administrators.contains(new Grant(guildId, userId));
    }

    public void grantAdministrator(GuildId guildId, UserId userId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        administrators.add(new Grant(guildId, userId));
    }

    public void revokeAdministrator(GuildId guildId, UserId userId) {
        administrators.remove(new Grant(guildId, userId));
    }
}
