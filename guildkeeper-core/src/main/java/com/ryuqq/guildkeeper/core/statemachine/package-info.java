/**
 * Guild lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.statemachine.GuildState} - Per-guild lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.statemachine.GuildStateTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * UNKNOWN → TRACKED (guild joined)
 * TRACKED → REMOVED (guild left)
 * UNKNOWN → REMOVED (left before this process saw a join)
 *
 * Forbidden:
 * - REMOVED → * (terminal; a re-join starts a new occurrence at UNKNOWN)
 * - TRACKED → UNKNOWN
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.core.statemachine;
