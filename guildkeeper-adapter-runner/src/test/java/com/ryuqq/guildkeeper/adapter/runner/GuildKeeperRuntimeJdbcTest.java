package com.ryuqq.guildkeeper.adapter.runner;

import com.ryuqq.guildkeeper.adapter.inmemory.gateway.InMemoryGateway;
import com.ryuqq.guildkeeper.adapter.inmemory.gateway.InMemoryPermissionOracle;
import com.ryuqq.guildkeeper.adapter.jdbc.JdbcSettingsStore;
import com.ryuqq.guildkeeper.adapter.jdbc.JdbcStoreConfig;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.concurrent.ScheduledExecutorService;

import static com.ryuqq.guildkeeper.testkit.contract.GuildFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * GuildKeeperRuntime + JdbcSettingsStore(SQLite) 통합 테스트.
 *
 * <p>프로세스 재시작 후에도 사용자 지정 prefix가 warm-up으로 복원되는지 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class GuildKeeperRuntimeJdbcTest {

    @TempDir
    Path tempDir;

    @Mock
    private ScheduledExecutorService presenceScheduler;

    @Mock
    private ScheduledExecutorService backgroundScheduler;

    private JdbcStoreConfig storeConfig;
    private InMemoryGateway gateway;
    private InMemoryPermissionOracle permissionOracle;

    @BeforeEach
    void setUp() {
        storeConfig = JdbcStoreConfig.sqliteFile(tempDir.resolve("guildkeeper.db"));
        gateway = new InMemoryGateway();
        permissionOracle = new InMemoryPermissionOracle();
        permissionOracle.grantAdministrator(GUILD_123, ADMIN_1);
    }

    private GuildKeeperRuntime newRuntime(JdbcSettingsStore store) {
        return new GuildKeeperRuntime(
            store, gateway, permissionOracle,
            new PresenceConfig(), new RedeliveryConfig(),
            presenceScheduler, backgroundScheduler, System::currentTimeMillis);
    }

    @Test
    void 재시작_후_warm_up이_저장된_prefix를_복원한다() {
        // given: 첫 번째 프로세스
        JdbcSettingsStore firstStore = JdbcSettingsStore.create(storeConfig);
        GuildKeeperRuntime first = newRuntime(firstStore);
        first.start();
        first.onGuildJoined(joined(GUILD_123, OWNER_42));
        first.onCommand("prefix", prefixCommand(GUILD_123, ADMIN_1, "!"));

        // when: 같은 DB 파일로 재시작
        GuildKeeperRuntime second = newRuntime(JdbcSettingsStore.create(storeConfig));
        second.start();

        // then
        assertThat(second.isWarmed()).isTrue();
        assertThat(second.getCache().get(GUILD_123).orElseThrow().prefix().getValue()).isEqualTo("!");
        Outcome view = second.onCommand("prefix", prefixCommand(GUILD_123, ADMIN_1, "")).orElseThrow();
        assertThat(view.message()).contains("```!```");
    }

    @Test
    void 탈퇴하면_재시작_후에도_설정이_남지_않는다() {
        // given
        GuildKeeperRuntime first = newRuntime(JdbcSettingsStore.create(storeConfig));
        first.onGuildJoined(joined(GUILD_123, OWNER_42));
        first.onGuildLeft(left(GUILD_123));

        // when
        GuildKeeperRuntime second = newRuntime(JdbcSettingsStore.create(storeConfig));
        second.start();

        // then
        assertThat(second.getCache().size()).isZero();
    }
}
