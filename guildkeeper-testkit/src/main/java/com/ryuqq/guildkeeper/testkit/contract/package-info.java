/**
 * Reusable SPI contract tests.
 *
 * <p>Adapters prove conformance by extending
 * {@link com.ryuqq.guildkeeper.testkit.contract.AbstractSettingsStoreContractTest}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.testkit.contract;
