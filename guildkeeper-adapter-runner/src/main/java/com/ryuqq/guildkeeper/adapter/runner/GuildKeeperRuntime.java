package com.ryuqq.guildkeeper.adapter.runner;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.application.command.PrefixCommand;
import com.ryuqq.guildkeeper.application.lifecycle.CacheWarmer;
import com.ryuqq.guildkeeper.application.lifecycle.GuildLifecycleHandler;
import com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents;
import com.ryuqq.guildkeeper.application.listener.GatewayEventListener;
import com.ryuqq.guildkeeper.core.contract.CacheReady;
import com.ryuqq.guildkeeper.core.contract.GuildJoined;
import com.ryuqq.guildkeeper.core.contract.GuildLeft;
import com.ryuqq.guildkeeper.core.contract.Invocation;
import com.ryuqq.guildkeeper.core.contract.LifecycleEvent;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import com.ryuqq.guildkeeper.core.outcome.Retry;
import com.ryuqq.guildkeeper.core.spi.Gateway;
import com.ryuqq.guildkeeper.core.spi.PermissionOracle;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * GuildKeeper 런타임 조립체.
 *
 * <p>저장소/게이트웨이/권한 어댑터를 받아 캐시, 라이프사이클 핸들러, prefix 명령,
 * presence 루프, 재전달 스캐너를 하나로 묶고 {@link GatewayEventListener}로 노출합니다.
 * 캐시는 이 인스턴스가 소유하며 모든 컴포넌트에 주입됩니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * 1. new GuildKeeperRuntime(store, gateway, permissionOracle)
 * 2. start()           → 캐시 warm-up (실패 시 재시도 예약), 재전달 스캔 스케줄링
 * 3. 게이트웨이 이벤트  → onGuildJoined / onGuildLeft / onCacheReady / onCommand
 * 4. shutdown()        → presence 루프와 재전달 스캐너 종료
 * </pre>
 *
 * <p><strong>Retry 처리:</strong></p>
 * <ul>
 *   <li>join/leave 결과가 Retry면 재전달 대기열에 적재</li>
 *   <li>Ok면 같은 길드의 오래된 대기 이벤트 폐기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuildKeeperRuntime implements GatewayEventListener {

    private static final Logger log = LoggerFactory.getLogger(GuildKeeperRuntime.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000;

    private final GuildSettingsCache cache;
    private final GuildLifecycleHandler lifecycleHandler;
    private final PendingLifecycleEvents pendingEvents;
    private final CacheWarmer cacheWarmer;
    private final PrefixCommand prefixCommand;
    private final PresenceSupervisor presenceSupervisor;
    private final LifecycleRedeliveryRunner redeliveryRunner;
    private final RedeliveryConfig redeliveryConfig;
    private final ScheduledExecutorService backgroundScheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean warmed = new AtomicBoolean(false);

    /**
     * 기본 설정으로 생성.
     */
    public GuildKeeperRuntime(SettingsStore store, Gateway gateway, PermissionOracle permissionOracle) {
        this(store, gateway, permissionOracle, new PresenceConfig(), new RedeliveryConfig());
    }

    /**
     * 커스텀 설정으로 생성. 백그라운드 작업은 전용 데몬 스레드에서 실행됩니다.
     */
    public GuildKeeperRuntime(
        SettingsStore store,
        Gateway gateway,
        PermissionOracle permissionOracle,
        PresenceConfig presenceConfig,
        RedeliveryConfig redeliveryConfig
    ) {
        this(store, gateway, permissionOracle, presenceConfig, redeliveryConfig,
            daemonScheduler("guildkeeper-presence"),
            daemonScheduler("guildkeeper-redelivery"),
            System::currentTimeMillis);
    }

    /**
     * 스케줄러와 시계 주입 생성자 (테스트용).
     *
     * @param store 설정 저장소
     * @param gateway 게이트웨이
     * @param permissionOracle 권한 조회
     * @param presenceConfig presence 설정
     * @param redeliveryConfig 재전달 설정
     * @param presenceScheduler presence 루프 스케줄러
     * @param backgroundScheduler warm-up 재시도 및 재전달 스캔 스케줄러
     * @param clock 현재 시각 공급자 (epoch millis)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GuildKeeperRuntime(
        SettingsStore store,
        Gateway gateway,
        PermissionOracle permissionOracle,
        PresenceConfig presenceConfig,
        RedeliveryConfig redeliveryConfig,
        ScheduledExecutorService presenceScheduler,
        ScheduledExecutorService backgroundScheduler,
        LongSupplier clock
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (permissionOracle == null) {
            throw new IllegalArgumentException("permissionOracle cannot be null");
        }
        if (presenceConfig == null) {
            throw new IllegalArgumentException("presenceConfig cannot be null");
        }
        if (redeliveryConfig == null) {
            throw new IllegalArgumentException("redeliveryConfig cannot be null");
        }
        if (backgroundScheduler == null) {
            throw new IllegalArgumentException("backgroundScheduler cannot be null");
        }
        this.cache = new GuildSettingsCache();
        this.lifecycleHandler = new GuildLifecycleHandler(store, cache);
        this.pendingEvents = new PendingLifecycleEvents();
        this.cacheWarmer = new CacheWarmer(store, cache, lifecycleHandler);
        this.prefixCommand = new PrefixCommand(store, cache, permissionOracle, gateway);
        this.presenceSupervisor = new PresenceSupervisor(
            new PresenceLoop(cache, gateway, presenceConfig), presenceConfig, presenceScheduler);
        this.redeliveryRunner = new LifecycleRedeliveryRunner(
            lifecycleHandler, pendingEvents, new BackoffCalculator(redeliveryConfig), redeliveryConfig, clock);
        this.redeliveryConfig = redeliveryConfig;
        this.backgroundScheduler = backgroundScheduler;
    }

    private static ScheduledExecutorService daemonScheduler(String threadName) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 캐시 warm-up 후 재전달 스캔을 시작합니다. 두 번째 호출부터는 무시됩니다.
     *
     * <p>warm-up 실패는 치명적이지 않습니다. 스캔 주기마다 다시 시도하며,
     * 그동안 명령은 저장소에서 즉시 로드하는 경로로 동작합니다.</p>
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("GuildKeeper runtime already started");
            return;
        }
        warmUp();
        long interval = redeliveryConfig.scanIntervalMs();
        backgroundScheduler.scheduleWithFixedDelay(this::scanPendingEvents, interval, interval, TimeUnit.MILLISECONDS);
        log.info("GuildKeeper runtime started (redelivery scan every {}ms)", interval);
    }

    private void warmUp() {
        if (cacheWarmer.warm()) {
            warmed.set(true);
            return;
        }
        long delay = redeliveryConfig.scanIntervalMs();
        log.warn("Cache warm-up failed, retrying in {}ms", delay);
        backgroundScheduler.schedule(this::warmUp, delay, TimeUnit.MILLISECONDS);
    }

    private void scanPendingEvents() {
        // 예외가 빠져나가면 scheduleWithFixedDelay가 이후 스캔을 취소함
        try {
            redeliveryRunner.scan();
        } catch (RuntimeException e) {
            log.error("Redelivery scan failed", e);
        }
    }

    @Override
    public Outcome onGuildJoined(GuildJoined event) {
        Outcome outcome = lifecycleHandler.onGuildJoined(event);
        afterLifecycleEvent(event, outcome);
        return outcome;
    }

    @Override
    public Outcome onGuildLeft(GuildLeft event) {
        Outcome outcome = lifecycleHandler.onGuildLeft(event);
        afterLifecycleEvent(event, outcome);
        return outcome;
    }

    private void afterLifecycleEvent(LifecycleEvent event, Outcome outcome) {
        if (outcome instanceof Retry) {
            redeliveryRunner.enqueue(event);
        } else {
            pendingEvents.discard(event.guildId());
        }
    }

    @Override
    public void onCacheReady(CacheReady event) {
        // 캐시에 설정이 없는 길드는 가입 이벤트나 재적재 전까지 UNKNOWN으로 둠
        int tracked = lifecycleHandler.track(event.knownGuilds());
        log.debug("Gateway cache ready: known={}, tracked={}", event.knownGuilds().size(), tracked);
        presenceSupervisor.onCacheReady();
    }

    @Override
    public Optional<Outcome> onCommand(String name, Invocation invocation) {
        if (!PrefixCommand.NAME.equals(name)) {
            return Optional.empty();
        }
        return Optional.of(prefixCommand.execute(invocation));
    }

    /**
     * 백그라운드 작업 Graceful Shutdown.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        presenceSupervisor.shutdown(SHUTDOWN_TIMEOUT_MS);
        backgroundScheduler.shutdown();
        if (!backgroundScheduler.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            backgroundScheduler.shutdownNow();
        }
        log.info("GuildKeeper runtime shut down ({} lifecycle events still pending)", pendingEvents.size());
    }

    public boolean isWarmed() {
        return warmed.get();
    }

    public GuildSettingsCache getCache() {
        return cache;
    }

    public GuildLifecycleHandler getLifecycleHandler() {
        return lifecycleHandler;
    }

    public PendingLifecycleEvents getPendingEvents() {
        return pendingEvents;
    }

    public PresenceSupervisor getPresenceSupervisor() {
        return presenceSupervisor;
    }

    public LifecycleRedeliveryRunner getRedeliveryRunner() {
        return redeliveryRunner;
    }
}
