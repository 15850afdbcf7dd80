package com.ryuqq.guildkeeper.adapter.jdbc;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.MuteType;
import com.ryuqq.guildkeeper.core.model.Prefix;
import com.ryuqq.guildkeeper.core.model.UserId;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import com.ryuqq.guildkeeper.core.spi.StoreReadException;
import com.ryuqq.guildkeeper.core.spi.StoreWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link SettingsStore} SPI.
 *
 * <p>One row per guild in {@code guild_settings}. Each method issues exactly one
 * auto-committed statement through {@link JdbcTemplate}.</p>
 *
 * <p><strong>SQL:</strong></p>
 * <pre>
 * insertIfAbsent: INSERT ... ON CONFLICT (guild_id) DO NOTHING
 * updatePrefix:   UPDATE guild_settings SET prefix = ? WHERE guild_id = ?
 * delete:         DELETE FROM guild_settings WHERE guild_id = ?
 * find:           SELECT ... WHERE guild_id = ?
 * loadAll:        SELECT ... ORDER BY guild_id
 * </pre>
 *
 * <p><strong>Error Translation:</strong></p>
 * <ul>
 *   <li>Write statements: {@link DataAccessException} → {@link StoreWriteException}</li>
 *   <li>Read statements: {@link DataAccessException} → {@link StoreReadException}</li>
 *   <li>Rows that fail domain validation (e.g. a prefix containing whitespace written by
 *       another tool) → {@link StoreReadException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * JdbcSettingsStore store = JdbcSettingsStore.create(JdbcStoreConfig.sqliteFile(Path.of("bot.db")));
 * store.insertIfAbsent(GuildSettings.defaults(guildId, ownerId));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JdbcSettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSettingsStore.class);

    static final String SCHEMA_LOCATION = "guildkeeper/schema.sql";

    private static final String COLUMNS = "guild_id, prefix, owner_id, mute_type, mute_role";

    private static final RowMapper<GuildSettings> ROW_MAPPER = (rs, rowNum) -> new GuildSettings(
        GuildId.of(rs.getLong("guild_id")),
        Prefix.of(rs.getString("prefix")),
        UserId.of(rs.getLong("owner_id")),
        MuteType.fromStorage(rs.getString("mute_type")),
        rs.getLong("mute_role")
    );

    private final JdbcTemplate jdbc;

    /**
     * 생성자.
     *
     * @param jdbc 설정된 JdbcTemplate
     * @throws IllegalArgumentException jdbc가 null인 경우
     */
    public JdbcSettingsStore(JdbcTemplate jdbc) {
        if (jdbc == null) {
            throw new IllegalArgumentException("jdbc cannot be null");
        }
        this.jdbc = jdbc;
    }

    /**
     * 설정으로부터 DataSource를 만들고 필요하면 스키마를 초기화합니다.
     *
     * @param config 저장소 설정
     * @return 사용 준비된 저장소
     * @throws StoreWriteException 스키마 초기화 실패 시
     */
    public static JdbcSettingsStore create(JdbcStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        DriverManagerDataSource dataSource = new DriverManagerDataSource(config.jdbcUrl());
        JdbcSettingsStore store = new JdbcSettingsStore(new JdbcTemplate(dataSource));
        if (config.initializeSchema()) {
            store.initializeSchema();
        }
        return store;
    }

    /**
     * {@code guildkeeper/schema.sql} 실행. 스크립트는 멱등입니다.
     */
    public void initializeSchema() {
        DataSource dataSource = jdbc.getDataSource();
        if (dataSource == null) {
            throw new IllegalStateException("JdbcTemplate has no DataSource");
        }
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        try {
            populator.execute(dataSource);
        } catch (DataAccessException e) {
            throw new StoreWriteException("Failed to initialize schema from " + SCHEMA_LOCATION, null, e);
        }
        log.info("Schema initialized from {}", SCHEMA_LOCATION);
    }

    @Override
    public boolean insertIfAbsent(GuildSettings defaults) {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        try {
            int rows = jdbc.update(
                """
                INSERT INTO guild_settings (guild_id, prefix, owner_id, mute_type, mute_role)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (guild_id) DO NOTHING
                """,
                defaults.guildId().getValue(),
                defaults.prefix().getValue(),
                defaults.ownerId().getValue(),
                defaults.muteType().storageValue(),
                defaults.muteRoleId());
            return rows > 0;
        } catch (DataAccessException e) {
            throw writeFailure("insert", defaults.guildId(), e);
        }
    }

    @Override
    public boolean updatePrefix(GuildId guildId, Prefix prefix) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        try {
            int rows = jdbc.update(
                "UPDATE guild_settings SET prefix = ? WHERE guild_id = ?",
                prefix.getValue(),
                guildId.getValue());
            return rows > 0;
        } catch (DataAccessException e) {
            throw writeFailure("update prefix", guildId, e);
        }
    }

    @Override
    public boolean delete(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        try {
            return jdbc.update("DELETE FROM guild_settings WHERE guild_id = ?", guildId.getValue()) > 0;
        } catch (DataAccessException e) {
            throw writeFailure("delete", guildId, e);
        }
    }

    @Override
    public Optional<GuildSettings> find(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        try {
            return Optional.ofNullable(jdbc.queryForObject(
                "SELECT " + COLUMNS + " FROM guild_settings WHERE guild_id = ?",
                ROW_MAPPER,
                guildId.getValue()));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw readFailure("find", guildId, e);
        } catch (IllegalArgumentException e) {
            throw new StoreReadException("Invalid settings row for guild " + guildId.getValue(), guildId, e);
        }
    }

    @Override
    public List<GuildSettings> loadAll() {
        try {
            return jdbc.query("SELECT " + COLUMNS + " FROM guild_settings ORDER BY guild_id", ROW_MAPPER);
        } catch (DataAccessException e) {
            throw readFailure("load all", null, e);
        } catch (IllegalArgumentException e) {
            throw new StoreReadException("Invalid settings row in guild_settings", null, e);
        }
    }

    private static StoreWriteException writeFailure(String operation, GuildId guildId, DataAccessException e) {
        log.debug("JDBC {} failed: guildId={}", operation, guildId, e);
        return new StoreWriteException(
            "Failed to " + operation + " settings for guild " + guildId.getValue(), guildId, e);
    }

    private static StoreReadException readFailure(String operation, GuildId guildId, DataAccessException e) {
        log.debug("JDBC {} failed: guildId={}", operation, guildId, e);
        String target = guildId != null ? "guild " + guildId.getValue() : "all guilds";
        return new StoreReadException("Failed to " + operation + " settings for " + target, guildId, e);
    }
}
