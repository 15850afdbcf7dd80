package com.ryuqq.guildkeeper.adapter.runner;

import com.ryuqq.guildkeeper.adapter.inmemory.store.InMemorySettingsStore;
import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.application.lifecycle.GuildLifecycleHandler;
import com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents;
import com.ryuqq.guildkeeper.application.lifecycle.PendingLifecycleEvents.PendingEvent;
import com.ryuqq.guildkeeper.core.outcome.ErrorKind;
import com.ryuqq.guildkeeper.core.outcome.Fail;
import com.ryuqq.guildkeeper.core.statemachine.GuildState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static com.ryuqq.guildkeeper.testkit.contract.GuildFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LifecycleRedeliveryRunner 테스트.
 *
 * <p>실제 GuildLifecycleHandler와 InMemorySettingsStore(장애 주입)로
 * 재전달, backoff, 시도 횟수 제한, latest-wins 동작을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LifecycleRedeliveryRunnerTest {

    private InMemorySettingsStore store;
    private GuildSettingsCache cache;
    private GuildLifecycleHandler handler;
    private PendingLifecycleEvents pending;
    private AtomicLong now;
    private LifecycleRedeliveryRunner runner;

    @BeforeEach
    void setUp() {
        store = new InMemorySettingsStore();
        cache = new GuildSettingsCache();
        handler = new GuildLifecycleHandler(store, cache);
        pending = new PendingLifecycleEvents();
        now = new AtomicLong(10_000L);
        RedeliveryConfig config = new RedeliveryConfig().withMaxAttempts(3).withBatchSize(10);
        runner = new LifecycleRedeliveryRunner(
            handler, pending, new BackoffCalculator(1000, 60000, 0.1, () -> 0.0), config, now::get);
    }

    // ============================================================
    // 1. 적재
    // ============================================================

    @Test
    void enqueue_첫_backoff_이후로_예약된다() {
        // when
        runner.enqueue(joined(GUILD_123, OWNER_42));

        // then
        PendingEvent entry = pending.peek(GUILD_123).orElseThrow();
        assertThat(entry.attempts()).isEqualTo(1);
        assertThat(entry.dueAtMillis()).isEqualTo(11_000L);
    }

    @Test
    void scan_기한_전에는_아무것도_처리하지_않는다() {
        // given
        runner.enqueue(joined(GUILD_123, OWNER_42));
        now.set(10_999L);

        // when
        int delivered = runner.scan();

        // then
        assertThat(delivered).isZero();
        assertThat(pending.size()).isEqualTo(1);
        assertThat(store.size()).isZero();
    }

    // ============================================================
    // 2. 재전달 결과별 처리
    // ============================================================

    @Test
    void scan_저장소가_복구되면_join이_반영되고_대기열에서_빠진다() {
        // given
        runner.enqueue(joined(GUILD_123, OWNER_42));
        now.set(11_000L);

        // when
        int delivered = runner.scan();

        // then
        assertThat(delivered).isEqualTo(1);
        assertThat(pending.size()).isZero();
        assertThat(store.find(GUILD_123)).isPresent();
        assertThat(cache.get(GUILD_123).orElseThrow().prefix().getValue()).isEqualTo("-");
        assertThat(handler.stateOf(GUILD_123)).isEqualTo(GuildState.TRACKED);
    }

    @Test
    void scan_계속_실패하면_backoff를_늘려_재적재하고_maxAttempts에서_폐기한다() {
        // given
        store.failWrites(true);
        runner.enqueue(left(GUILD_123));

        // when: 두 번째 시도 실패 → attempts=2, 2000ms 후
        now.set(11_000L);
        runner.scan();

        // then
        PendingEvent second = pending.peek(GUILD_123).orElseThrow();
        assertThat(second.attempts()).isEqualTo(2);
        assertThat(second.dueAtMillis()).isEqualTo(13_000L);

        // when: 세 번째 시도 실패 → maxAttempts(3) 도달, 폐기
        now.set(13_000L);
        runner.scan();

        // then
        assertThat(pending.size()).isZero();
    }

    @Test
    void scan_핸들러_예외도_재시도로_취급한다() {
        // given
        GuildLifecycleHandler failingHandler = mock(GuildLifecycleHandler.class);
        when(failingHandler.handle(any())).thenThrow(new IllegalStateException("boom"));
        LifecycleRedeliveryRunner failingRunner = new LifecycleRedeliveryRunner(
            failingHandler, pending, new BackoffCalculator(1000, 60000, 0.0, () -> 0.0),
            new RedeliveryConfig(), now::get);
        failingRunner.enqueue(joined(GUILD_456, OWNER_7));
        failingRunner.enqueue(joined(GUILD_789, OWNER_7));
        now.set(11_000L);

        // when
        int delivered = failingRunner.scan();

        // then
        assertThat(delivered).isZero();
        assertThat(pending.size()).isEqualTo(2);
        assertThat(pending.peek(GUILD_456).orElseThrow().attempts()).isEqualTo(2);
    }

    @Test
    void scan_Fail_결과는_재시도하지_않는다() {
        // given
        GuildLifecycleHandler failingHandler = mock(GuildLifecycleHandler.class);
        when(failingHandler.handle(any())).thenReturn(Fail.of(ErrorKind.VALIDATION_ERROR, "rejected"));
        LifecycleRedeliveryRunner failingRunner = new LifecycleRedeliveryRunner(
            failingHandler, pending, new BackoffCalculator(1000, 60000, 0.0, () -> 0.0),
            new RedeliveryConfig(), now::get);
        failingRunner.enqueue(left(GUILD_123));
        now.set(20_000L);

        // when
        failingRunner.scan();

        // then
        assertThat(pending.size()).isZero();
    }

    // ============================================================
    // 3. 순서 (latest wins)
    // ============================================================

    @Test
    void 실패한_재전달이_더_새로운_이벤트를_덮어쓰지_않는다() {
        // given: join이 재전달 대기 중, 저장소 장애
        store.failWrites(true);
        runner.enqueue(joined(GUILD_123, OWNER_42));
        now.set(11_000L);
        PendingEvent drained = pending.drainDue(now.get(), 1).get(0);

        // 재전달 처리 도중 leave가 들어와 대기열에 적재됨
        runner.enqueue(left(GUILD_123));
        pending.requeue(new PendingEvent(drained.event(), 2, 13_000L));

        // then
        assertThat(pending.peek(GUILD_123).orElseThrow().event()).isEqualTo(left(GUILD_123));
    }

    @Test
    void 배치_크기만큼만_처리한다() {
        // given
        LifecycleRedeliveryRunner smallBatch = new LifecycleRedeliveryRunner(
            handler, pending, new BackoffCalculator(1000, 60000, 0.0, () -> 0.0),
            new RedeliveryConfig().withBatchSize(1), now::get);
        smallBatch.enqueue(joined(GUILD_123, OWNER_42));
        smallBatch.enqueue(joined(GUILD_456, OWNER_7));
        now.set(11_000L);

        // when
        int delivered = smallBatch.scan();

        // then
        assertThat(delivered).isEqualTo(1);
        assertThat(pending.size()).isEqualTo(1);
    }

    @Test
    void maxAttempts가_1이면_적재하지_않는다() {
        // given
        GuildLifecycleHandler mockHandler = mock(GuildLifecycleHandler.class);
        LifecycleRedeliveryRunner noRetry = new LifecycleRedeliveryRunner(
            mockHandler, pending, new BackoffCalculator(1000, 60000, 0.0, () -> 0.0),
            new RedeliveryConfig().withMaxAttempts(1), now::get);

        // when
        noRetry.enqueue(joined(GUILD_123, OWNER_42));
        now.set(100_000L);
        noRetry.scan();

        // then
        assertThat(pending.size()).isZero();
        verify(mockHandler, never()).handle(any());
    }

    @Test
    void 의존성이_null이면_예외() {
        assertThatThrownBy(() -> new LifecycleRedeliveryRunner(
            null, pending, new BackoffCalculator(new RedeliveryConfig()), new RedeliveryConfig(), now::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("handler cannot be null");
        assertThatThrownBy(() -> runner.enqueue(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
