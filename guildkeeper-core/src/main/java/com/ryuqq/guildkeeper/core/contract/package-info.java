/**
 * Contracts exchanged with the chat gateway.
 *
 * <p>This package defines the inbound messages the gateway delivers to the core.
 * Only identifiers and cardinalities are carried; rendering and transport stay
 * outside the core.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.contract.LifecycleEvent} - Sealed join/leave event type</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.contract.GuildJoined} - Bot joined (or was re-announced to) a guild</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.contract.GuildLeft} - Bot left a guild</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.contract.CacheReady} - Gateway cache populated, may recur</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.contract.Invocation} - Parsed command invocation context</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.core.contract;
