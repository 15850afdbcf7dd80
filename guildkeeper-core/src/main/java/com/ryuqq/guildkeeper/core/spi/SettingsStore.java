package com.ryuqq.guildkeeper.core.spi;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.Prefix;

import java.util.List;
import java.util.Optional;

/**
 * Durable Storage SPI for per-guild settings.
 *
 * <p>The store is the system of record. The in-memory cache mirrors it and is
 * always written <em>after</em> the store confirms a write, so a crash between
 * the two leaves the cache lagging but never the store.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Idempotent first-contact insert (duplicate join events)</li>
 *   <li>Single-field prefix updates</li>
 *   <li>Row removal when the bot leaves a guild</li>
 *   <li>Point and bulk reads for just-in-time loads and startup warm-up</li>
 * </ul>
 *
 * <p><strong>Logical Schema:</strong></p>
 * <pre>
 * guild_settings(
 *   guild_id  INTEGER PRIMARY KEY,
 *   prefix    TEXT,
 *   owner_id  INTEGER,
 *   mute_type TEXT    DEFAULT 'timeout',
 *   mute_role INTEGER DEFAULT 0
 * )
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Every operation touches a single row and is auto-committed</li>
 *   <li>Thread-safe: all methods may be called concurrently from many tasks</li>
 *   <li>Failures are raised as {@link StoreWriteException} / {@link StoreReadException},
 *       never swallowed and never reported as a {@code false} return value</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SettingsStore {

    /**
     * Inserts the given settings unless a row for the guild already exists.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * INSERT INTO guild_settings (guild_id, prefix, owner_id, mute_type, mute_role)
     * VALUES (?, ?, ?, ?, ?)
     * ON CONFLICT DO NOTHING;
     * </pre>
     *
     * <p><strong>Idempotency:</strong> A duplicate call never errors and never overwrites
     * an existing row, so a customised prefix survives repeated join events.</p>
     *
     * @param defaults the settings to insert
     * @return true if a row was inserted, false if one already existed
     * @throws IllegalArgumentException if defaults is null
     * @throws StoreWriteException if the write fails
     */
    boolean insertIfAbsent(GuildSettings defaults);

    /**
     * Updates the prefix of an existing row.
     *
     * <pre>
     * UPDATE guild_settings SET prefix = ? WHERE guild_id = ?;
     * </pre>
     *
     * @param guildId the guild
     * @param prefix the new prefix
     * @return true if a row was updated, false if no row exists for the guild
     * @throws IllegalArgumentException if guildId or prefix is null
     * @throws StoreWriteException if the write fails
     */
    boolean updatePrefix(GuildId guildId, Prefix prefix);

    /**
     * Deletes the row of the guild.
     *
     * <pre>
     * DELETE FROM guild_settings WHERE guild_id = ?;
     * </pre>
     *
     * @param guildId the guild
     * @return true if a row was deleted, false if none existed
     * @throws IllegalArgumentException if guildId is null
     * @throws StoreWriteException if the delete fails
     */
    boolean delete(GuildId guildId);

    /**
     * Reads the row of the guild.
     *
     * @param guildId the guild
     * @return the stored settings, or empty if no row exists
     * @throws IllegalArgumentException if guildId is null
     * @throws StoreReadException if the read fails
     */
    Optional<GuildSettings> find(GuildId guildId);

    /**
     * Reads every row, used to warm the cache at startup.
     *
     * @return all stored settings (may be empty)
     * @throws StoreReadException if the read fails
     */
    List<GuildSettings> loadAll();
}
