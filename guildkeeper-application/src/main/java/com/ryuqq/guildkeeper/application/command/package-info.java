/**
 * User-facing commands.
 *
 * <p>Commands validate before they mutate, write the store before the cache,
 * and always answer the invoking channel.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.application.command;
