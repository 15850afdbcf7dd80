/**
 * Processing results for lifecycle events and commands.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.outcome.Outcome} - Sealed result type</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.outcome.Ok} - Completed successfully</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.outcome.Retry} - Store failure, event left unprocessed</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.outcome.Fail} - Terminal failure reported to the user</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.outcome.ErrorKind} - Failure classification</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.core.outcome;
