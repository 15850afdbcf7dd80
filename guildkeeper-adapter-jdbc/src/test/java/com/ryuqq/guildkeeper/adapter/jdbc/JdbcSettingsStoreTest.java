package com.ryuqq.guildkeeper.adapter.jdbc;

import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.Prefix;
import com.ryuqq.guildkeeper.core.spi.StoreReadException;
import com.ryuqq.guildkeeper.core.spi.StoreWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;

import static com.ryuqq.guildkeeper.testkit.contract.GuildFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JdbcSettingsStore 테스트.
 *
 * <p>영속성, 스키마 초기화, 예외 변환을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JdbcSettingsStoreTest {

    @TempDir
    Path tempDir;

    private JdbcStoreConfig config() {
        return JdbcStoreConfig.sqliteFile(tempDir.resolve("guilds.db"));
    }

    // ============================================================
    // 1. 영속성 / 스키마
    // ============================================================

    @Test
    void 재시작_후에도_행이_유지된다() {
        // given
        JdbcSettingsStore first = JdbcSettingsStore.create(config());
        first.insertIfAbsent(GuildSettings.defaults(GUILD_123, OWNER_42));
        first.updatePrefix(GUILD_123, Prefix.of("!"));

        // when
        JdbcSettingsStore second = JdbcSettingsStore.create(config());

        // then
        assertThat(second.find(GUILD_123).orElseThrow().prefix().getValue()).isEqualTo("!");
        assertThat(second.loadAll()).hasSize(1);
    }

    @Test
    void 스키마_초기화는_여러_번_실행해도_안전하다() {
        // given
        JdbcSettingsStore store = JdbcSettingsStore.create(config());
        store.insertIfAbsent(GuildSettings.defaults(GUILD_123, OWNER_42));

        // when
        store.initializeSchema();

        // then
        assertThat(store.find(GUILD_123)).isPresent();
    }

    @Test
    void 컬럼_기본값은_timeout과_0이다() {
        // given
        JdbcSettingsStore store = JdbcSettingsStore.create(config());
        JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource(config().jdbcUrl()));

        // when
        jdbc.update("INSERT INTO guild_settings (guild_id, prefix, owner_id) VALUES (?, ?, ?)", 123L, "-", 42L);

        // then
        assertThat(store.find(GUILD_123)).contains(GuildSettings.defaults(GUILD_123, OWNER_42));
    }

    // ============================================================
    // 2. 예외 변환
    // ============================================================

    @Test
    void 테이블이_없으면_쓰기는_StoreWriteException으로_변환된다() {
        // given
        JdbcSettingsStore store = JdbcSettingsStore.create(config().withInitializeSchema(false));

        // when & then
        assertThatThrownBy(() -> store.insertIfAbsent(GuildSettings.defaults(GUILD_123, OWNER_42)))
            .isInstanceOf(StoreWriteException.class)
            .hasCauseInstanceOf(DataAccessException.class)
            .satisfies(e -> assertThat(((StoreWriteException) e).getGuildId()).isEqualTo(GUILD_123));
        assertThatThrownBy(() -> store.updatePrefix(GUILD_123, Prefix.of("!")))
            .isInstanceOf(StoreWriteException.class);
        assertThatThrownBy(() -> store.delete(GUILD_123))
            .isInstanceOf(StoreWriteException.class);
    }

    @Test
    void 테이블이_없으면_읽기는_StoreReadException으로_변환된다() {
        // given
        JdbcSettingsStore store = JdbcSettingsStore.create(config().withInitializeSchema(false));

        // when & then
        assertThatThrownBy(() -> store.find(GUILD_123))
            .isInstanceOf(StoreReadException.class);
        assertThatThrownBy(store::loadAll)
            .isInstanceOf(StoreReadException.class);
    }

    @Test
    void 공백이_포함된_prefix_행은_StoreReadException으로_거부된다() {
        // given
        JdbcSettingsStore store = JdbcSettingsStore.create(config());
        JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource(config().jdbcUrl()));
        jdbc.update("INSERT INTO guild_settings (guild_id, prefix, owner_id) VALUES (?, ?, ?)", 123L, "a b", 42L);

        // when & then
        assertThatThrownBy(() -> store.find(GUILD_123))
            .isInstanceOf(StoreReadException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. 설정
    // ============================================================

    @Test
    void config_기본값과_검증() {
        assertThat(new JdbcStoreConfig().jdbcUrl()).isEqualTo(JdbcStoreConfig.DEFAULT_JDBC_URL);
        assertThat(new JdbcStoreConfig().initializeSchema()).isTrue();
        assertThat(config().jdbcUrl()).startsWith("jdbc:sqlite:").endsWith("guilds.db");
        assertThatThrownBy(() -> new JdbcStoreConfig(" ", true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
