/**
 * In-memory {@link com.ryuqq.guildkeeper.core.spi.SettingsStore} for tests and local runs.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.adapter.inmemory.store;
