package com.ryuqq.guildkeeper.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Presence 루프 단일 기동 관리자.
 *
 * <p>게이트웨이의 cache_ready 신호는 재연결마다 여러 번 올 수 있습니다.
 * 루프 기동을 {@link FutureTask}로 감싸 두고 신호마다 {@code run()}을 호출합니다.
 * {@code FutureTask.run()}은 최초 한 번만 callable을 실행하므로
 * 신호가 동시에 몰려도 루프는 정확히 하나만 스케줄됩니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * new PresenceSupervisor(loop, config, scheduler) → 미기동
 * onCacheReady()                         → scheduleAtFixedRate(loop, 0, intervalMs)
 * onCacheReady() (이후)                  → no-op
 * shutdown()                             → 스케줄러 종료 (프로세스 종료 시)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PresenceSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PresenceSupervisor.class);

    private final ScheduledExecutorService scheduler;
    private final FutureTask<ScheduledFuture<?>> launch;

    /**
     * 생성자. 스케줄러의 종료 책임은 이 인스턴스로 넘어옵니다.
     *
     * @param loop 주기 실행할 presence 틱
     * @param config presence 설정
     * @param scheduler 루프를 실행할 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PresenceSupervisor(PresenceLoop loop, PresenceConfig config, ScheduledExecutorService scheduler) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        this.launch = new FutureTask<>(() -> {
            ScheduledFuture<?> handle = scheduler.scheduleAtFixedRate(
                loop, 0, config.intervalMs(), TimeUnit.MILLISECONDS);
            log.info("Presence loop started (interval={}ms)", config.intervalMs());
            return handle;
        });
    }

    /**
     * cache_ready 신호 처리. 최초 호출에서만 루프를 기동합니다.
     */
    public void onCacheReady() {
        if (launch.isDone()) {
            log.debug("Presence loop already started, ignoring cache_ready");
            return;
        }
        launch.run();
    }

    /**
     * 루프 기동 여부.
     *
     * @return 기동 완료 시 true (기동 중 예외가 발생한 경우도 완료로 간주)
     */
    public boolean isStarted() {
        return launch.isDone();
    }

    /**
     * 스케줄러 Graceful Shutdown.
     *
     * <p>실행 중인 틱은 완료를 기다리고, 타임아웃 시 강제 종료합니다.</p>
     *
     * @param timeoutMs 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void shutdown(long timeoutMs) throws InterruptedException {
        // 아직 기동 전이면 이후 신호가 루프를 띄우지 못하도록 취소
        launch.cancel(false);
        scheduler.shutdown();
        if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Presence supervisor shut down");
    }
}
