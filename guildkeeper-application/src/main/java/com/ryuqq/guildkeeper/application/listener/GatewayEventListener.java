package com.ryuqq.guildkeeper.application.listener;

import com.ryuqq.guildkeeper.core.contract.CacheReady;
import com.ryuqq.guildkeeper.core.contract.GuildJoined;
import com.ryuqq.guildkeeper.core.contract.GuildLeft;
import com.ryuqq.guildkeeper.core.contract.Invocation;
import com.ryuqq.guildkeeper.core.outcome.Outcome;

import java.util.Optional;

/**
 * Inbound port for events delivered by the chat platform gateway.
 *
 * <p>The gateway calls one method per inbound event, each on its own task.
 * Implementations must be safe for concurrent invocation; operations on
 * different guilds are not ordered relative to each other.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface GatewayEventListener {

    /**
     * The bot was added to a guild, or the gateway re-announced one it is already in.
     *
     * @param event join event
     * @return {@code Ok}, or {@code Retry} when the store was unavailable
     */
    Outcome onGuildJoined(GuildJoined event);

    /**
     * The bot was removed from a guild.
     *
     * @param event leave event
     * @return {@code Ok}, or {@code Retry} when the store was unavailable
     */
    Outcome onGuildLeft(GuildLeft event);

    /**
     * The gateway finished populating its own caches. May fire many times per process.
     *
     * @param event the guilds the gateway currently knows about
     */
    void onCacheReady(CacheReady event);

    /**
     * A user invoked a command.
     *
     * @param name command name without prefix
     * @param invocation invocation context
     * @return the outcome, or empty when no command with that name exists
     */
    Optional<Outcome> onCommand(String name, Invocation invocation);
}
