package com.ryuqq.guildkeeper.adapter.jdbc;

import java.nio.file.Path;

/**
 * JdbcSettingsStore 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>jdbcUrl: JDBC 연결 URL (기본값: jdbc:sqlite:guildkeeper.db)</li>
 *   <li>initializeSchema: 시작 시 {@code guildkeeper/schema.sql} 실행 여부 (기본값: true)</li>
 * </ul>
 *
 * @param jdbcUrl JDBC 연결 URL
 * @param initializeSchema 스키마 초기화 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JdbcStoreConfig(String jdbcUrl, boolean initializeSchema) {

    public static final String DEFAULT_JDBC_URL = "jdbc:sqlite:guildkeeper.db";

    /**
     * Compact Constructor with validation.
     *
     * @throws IllegalArgumentException jdbcUrl이 null이거나 비어 있는 경우
     */
    public JdbcStoreConfig {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be null or blank");
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public JdbcStoreConfig() {
        this(DEFAULT_JDBC_URL, true);
    }

    /**
     * 로컬 SQLite 파일을 사용하는 설정.
     */
    public static JdbcStoreConfig sqliteFile(Path databaseFile) {
        if (databaseFile == null) {
            throw new IllegalArgumentException("databaseFile cannot be null");
        }
        return new JdbcStoreConfig("jdbc:sqlite:" + databaseFile.toAbsolutePath(), true);
    }

    public JdbcStoreConfig withJdbcUrl(String jdbcUrl) {
        return new JdbcStoreConfig(jdbcUrl, initializeSchema);
    }

    public JdbcStoreConfig withInitializeSchema(boolean initializeSchema) {
        return new JdbcStoreConfig(jdbcUrl, initializeSchema);
    }
}
