/**
 * Guild settings domain model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.model.GuildId} - Platform-assigned guild identifier</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.model.UserId} - Platform-assigned user identifier</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.model.Prefix} - Whitespace-free command prefix</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.model.MuteType} - Mute strategy (TIMEOUT or ROLE)</li>
 * </ul>
 *
 * <h2>Settings Row</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.model.GuildSettings} - Per-guild configuration, one per guild</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable; changes create new instances</li>
 *   <li><strong>Validation on construction:</strong> Invalid values never leave a factory method</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.core.model;
