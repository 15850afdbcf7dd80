/**
 * Inbound gateway port.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.guildkeeper.application.listener;
