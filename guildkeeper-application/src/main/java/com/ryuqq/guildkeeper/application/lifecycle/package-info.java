/**
 * Guild lifecycle processing.
 *
 * <p>Join and leave events write the store first and the cache second.
 * Store failures become {@link com.ryuqq.guildkeeper.core.outcome.Retry} outcomes
 * and are parked in {@link com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents}
 * until a redelivery scan picks them up.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.application.lifecycle;
