package com.ryuqq.guildkeeper.application.command;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.Prefix;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import com.ryuqq.guildkeeper.core.spi.Gateway;
import com.ryuqq.guildkeeper.core.spi.PermissionOracle;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static com.ryuqq.guildkeeper.testkit.contract.GuildFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 같은 길드에 대한 동시 prefix 변경이 저장소와 캐시에 같은 순서로 반영되는지 검증.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PrefixCommandOrderingTest {

    @Mock
    private SettingsStore store;

    @Mock
    private PermissionOracle permissionOracle;

    @Mock
    private Gateway gateway;

    private GuildSettingsCache cache;
    private PrefixCommand command;

    @BeforeEach
    void setUp() {
        cache = new GuildSettingsCache();
        cache.putIfAbsent(GuildSettings.defaults(GUILD_123, OWNER_42));
        command = new PrefixCommand(store, cache, permissionOracle, gateway);
        when(permissionOracle.isAdministrator(GUILD_123, ADMIN_1)).thenReturn(true);
    }

    @Test
    void 먼저_저장된_변경의_캐시_반영이_끝나야_다음_변경이_저장소에_쓰인다() throws Exception {
        // given: "!" 저장 직후 캐시 반영 전에 멈춤
        AtomicReference<Prefix> stored = new AtomicReference<>();
        CountDownLatch firstWritten = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.updatePrefix(eq(GUILD_123), any())).thenAnswer(invocation -> {
            Prefix prefix = invocation.getArgument(1);
            stored.set(prefix);
            if ("!".equals(prefix.getValue())) {
                firstWritten.countDown();
                release.await(10, TimeUnit.SECONDS);
            }
            return true;
        });

        CompletableFuture<Outcome> first = CompletableFuture.supplyAsync(
            () -> command.execute(prefixCommand(GUILD_123, ADMIN_1, "!")));
        assertThat(firstWritten.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        CompletableFuture<Outcome> second = CompletableFuture.supplyAsync(
            () -> command.execute(prefixCommand(GUILD_123, ADMIN_1, "?")));
        try {
            // then: 두 번째 변경은 첫 번째가 끝날 때까지 저장소에 닿지 않음
            assertThatThrownBy(() -> second.get(300, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);
            verify(store, never()).updatePrefix(GUILD_123, Prefix.of("?"));
        } finally {
            release.countDown();
        }

        assertThat(first.get(5, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(stored.get().getValue()).isEqualTo("?");
        assertThat(cache.get(GUILD_123).orElseThrow().prefix()).isEqualTo(stored.get());
    }
}
