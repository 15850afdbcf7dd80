/**
 * Recording gateway and grant-based permission oracle.
 *
 * <p>Both stand in for the chat platform in tests; they record outbound calls
 * and support failure injection.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.adapter.inmemory.gateway;
