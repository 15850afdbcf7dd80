/**
 * JDBC {@link com.ryuqq.guildkeeper.core.spi.SettingsStore} over the {@code guild_settings} table.
 *
 * <p>Statements run through Spring's {@code JdbcTemplate}; every call is a single
 * auto-committed statement. {@code DataAccessException}s are translated into the
 * core {@link com.ryuqq.guildkeeper.core.spi.StoreException} hierarchy.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.adapter.jdbc;
