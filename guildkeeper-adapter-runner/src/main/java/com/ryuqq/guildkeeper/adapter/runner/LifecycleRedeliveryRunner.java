package com.ryuqq.guildkeeper.adapter.runner;

import com.ryuqq.guildkeeper.application.lifecycle.GuildLifecycleHandler;
import com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents;
import com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents.PendingEvent;
import com.ryuqq.guildkeeper.core.contract.LifecycleEvent;
import com.ryuqq.guildkeeper.core.outcome.Fail;
import com.ryuqq.guildkeeper.core.outcome.Ok;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * 라이프사이클 이벤트 재전달 컴포넌트.
 *
 * <p>저장소 장애로 처리되지 못한 join/leave 이벤트를 주기적으로 다시 처리합니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. GuildLifecycleHandler가 store.insertIfAbsent() 실패 → Retry
 * 2. GuildKeeperRuntime이 enqueue(event) → PendingLifecycleEvents에 적재
 * 3. 주기적으로 scan() 실행 → dueAt이 지난 이벤트를 꺼내 handler.handle()
 * 4. 결과에 따라:
 *    - Ok    → 완료
 *    - Retry → attempts+1, backoff 후 재적재 (maxAttempts 초과 시 폐기)
 *    - Fail  → 폐기 (재시도 불가)
 * </pre>
 *
 * <p><strong>순서 보장:</strong></p>
 * <ul>
 *   <li>길드당 대기 이벤트는 하나 (latest wins)</li>
 *   <li>재적재 중 같은 길드의 새 이벤트가 들어왔다면 오래된 이벤트는 버려짐</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LifecycleRedeliveryRunner {

    private static final Logger log = LoggerFactory.getLogger(LifecycleRedeliveryRunner.class);

    private final GuildLifecycleHandler handler;
    private final PendingLifecycleEvents pending;
    private final BackoffCalculator backoff;
    private final RedeliveryConfig config;
    private final LongSupplier clock;

    /**
     * 생성자.
     *
     * @param handler 라이프사이클 핸들러
     * @param pending 재전달 대기열
     * @param backoff 재시도 간격 계산기
     * @param config 설정
     * @param clock 현재 시각 공급자 (epoch millis)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LifecycleRedeliveryRunner(
        GuildLifecycleHandler handler,
        PendingLifecycleEvents pending,
        BackoffCalculator backoff,
        RedeliveryConfig config,
        LongSupplier clock
    ) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (pending == null) {
            throw new IllegalArgumentException("pending cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.handler = handler;
        this.pending = pending;
        this.backoff = backoff;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 실시간 처리에 실패한 이벤트 적재.
     *
     * <p>첫 실패로 간주하고 backoff 이후에 재전달됩니다.</p>
     *
     * @param event Retry가 된 이벤트
     */
    public void enqueue(LifecycleEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (config.maxAttempts() <= 1) {
            log.error("Dropping {} for guild {}: redelivery disabled (maxAttempts={})",
                event.getClass().getSimpleName(), event.guildId(), config.maxAttempts());
            return;
        }
        long dueAt = backoff.nextDueAt(clock.getAsLong(), 1);
        pending.offer(event, dueAt);
        log.debug("Lifecycle event queued for redelivery: guildId={}, dueAt={}", event.guildId(), dueAt);
    }

    /**
     * 기한이 된 대기 이벤트 재전달.
     *
     * <p>주기적으로 호출되어야 합니다 (GuildKeeperRuntime이 스케줄링).</p>
     *
     * @return 이번 스캔에서 성공적으로 처리된 이벤트 수
     */
    public int scan() {
        List<PendingEvent> due = pending.drainDue(clock.getAsLong(), config.batchSize());
        if (due.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (PendingEvent entry : due) {
            if (tryRedeliver(entry)) {
                delivered++;
            }
        }

        log.info("Redelivery scan completed: {} delivered out of {} due, {} still pending",
            delivered, due.size(), pending.size());
        return delivered;
    }

    /**
     * 개별 이벤트 재전달 시도.
     *
     * <p>예외 발생 시에도 다른 이벤트 처리를 방해하지 않습니다.</p>
     */
    private boolean tryRedeliver(PendingEvent entry) {
        Outcome outcome;
        try {
            outcome = handler.handle(entry.event());
        } catch (RuntimeException e) {
            log.error("Unexpected failure redelivering {} for guild {}",
                entry.event().getClass().getSimpleName(), entry.guildId(), e);
            reschedule(entry);
            return false;
        }

        if (outcome instanceof Ok) {
            log.info("Redelivered {} for guild {} after {} failed attempt(s)",
                entry.event().getClass().getSimpleName(), entry.guildId(), entry.attempts());
            return true;
        }
        if (outcome instanceof Fail fail) {
            log.error("Dropping {} for guild {}: {} ({})",
                entry.event().getClass().getSimpleName(), entry.guildId(), fail.errorKind(), fail.message());
            return false;
        }
        reschedule(entry);
        return false;
    }

    private void reschedule(PendingEvent entry) {
        int attempts = entry.attempts() + 1;
        if (attempts >= config.maxAttempts()) {
            log.error("Dropping {} for guild {}: gave up after {} attempts",
                entry.event().getClass().getSimpleName(), entry.guildId(), attempts);
            return;
        }
        PendingEvent next = new PendingEvent(entry.event(), attempts, backoff.nextDueAt(clock.getAsLong(), attempts));
        if (pending.requeue(next)) {
            log.warn("Redelivery of {} for guild {} failed, attempt {}/{} due at {}",
                entry.event().getClass().getSimpleName(), entry.guildId(),
                attempts, config.maxAttempts(), next.dueAtMillis());
        } else {
            log.debug("Newer event already pending for guild {}, discarding attempt {}",
                entry.guildId(), attempts);
        }
    }
}
