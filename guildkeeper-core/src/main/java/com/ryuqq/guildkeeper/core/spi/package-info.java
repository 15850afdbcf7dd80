/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.core.spi.SettingsStore} - Durable guild settings (system of record)</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.spi.Gateway} - Presence publishing and command replies</li>
 *   <li>{@link com.ryuqq.guildkeeper.core.spi.PermissionOracle} - Administrator check</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (guildkeeper-adapter-inmemory, guildkeeper-adapter-jdbc)
 * provide concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, JDBC for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.core.spi;
