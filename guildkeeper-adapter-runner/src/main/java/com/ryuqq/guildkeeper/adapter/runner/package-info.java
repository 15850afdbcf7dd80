/**
 * Runner Adapter Layer - 백그라운드 실행 컴포넌트와 런타임 조립.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guildkeeper.adapter.runner.GuildKeeperRuntime} - 전체 조립 및 게이트웨이 이벤트 진입점</li>
 *   <li>{@link com.ryuqq.guildkeeper.adapter.runner.PresenceSupervisor} - presence 루프 단일 기동</li>
 *   <li>{@link com.ryuqq.guildkeeper.adapter.runner.LifecycleRedeliveryRunner} - Retry 이벤트 재전달</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (GuildKeeperRuntime)
 *   ↓ implements
 * application (GatewayEventListener)
 *   ↓ depends on
 * core (GuildSettings, LifecycleEvent, Outcome, SettingsStore/Gateway SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.guildkeeper.adapter.runner;
