/**
 * In-process guild settings cache.
 *
 * <p>{@link com.ryuqq.guildkeeper.application.cache.GuildSettingsCache} is the single
 * owned cache injected into every handler. It never performs I/O.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.application.cache;
