package com.ryuqq.guildkeeper.adapter.inmemory.store;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.Prefix;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import com.ryuqq.guildkeeper.core.spi.StoreReadException;
import com.ryuqq.guildkeeper.core.spi.StoreWriteException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link SettingsStore} SPI for testing and reference purposes.
 *
 * <p>Rows live in a {@link ConcurrentHashMap} keyed by {@link GuildId}. Every operation
 * is a single atomic map call, which mirrors the single-row auto-committed statements of
 * the JDBC adapter.</p>
 *
 * <p><strong>Failure Injection:</strong></p>
 * <ul>
 *   <li>{@link #failWrites(boolean)} - every write raises {@link StoreWriteException}</li>
 *   <li>{@link #failReads(boolean)} - every read raises {@link StoreReadException}</li>
 * </ul>
 * <p>Injected failures never change stored rows.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemorySettingsStore store = new InMemorySettingsStore();
 * store.insertIfAbsent(GuildSettings.defaults(guildId, ownerId));
 *
 * store.failWrites(true);
 * store.updatePrefix(guildId, Prefix.of("!"));   // throws StoreWriteException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySettingsStore implements SettingsStore {

    private final ConcurrentHashMap<GuildId, GuildSettings> rows = new ConcurrentHashMap<>();
    private final AtomicBoolean writeFailure = new AtomicBoolean(false);
    private final AtomicBoolean readFailure = new AtomicBoolean(false);
    private final AtomicInteger writeCount = new AtomicInteger();

    /**
     * {@inheritDoc}
     *
     * <p>Implemented with {@link ConcurrentHashMap#putIfAbsent}, so a duplicate never
     * overwrites a customised row.</p>
     */
    @Override
    public boolean insertIfAbsent(GuildSettings defaults) {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        checkWritable(defaults.guildId());
        writeCount.incrementAndGet();
        return rows.putIfAbsent(defaults.guildId(), defaults) == null;
    }

    @Override
    public boolean updatePrefix(GuildId guildId, Prefix prefix) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        checkWritable(guildId);
        writeCount.incrementAndGet();
        return rows.computeIfPresent(guildId, (id, row) -> row.withPrefix(prefix)) != null;
    }

    @Override
    public boolean delete(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        checkWritable(guildId);
        writeCount.incrementAndGet();
        return rows.remove(guildId) != null;
    }

    @Override
    public Optional<GuildSettings> find(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        checkReadable(guildId);
        return Optional.ofNullable(rows.get(guildId));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Rows are returned ordered by guild id.</p>
     */
    @Override
    public List<GuildSettings> loadAll() {
        checkReadable(null);
        List<GuildSettings> all = new ArrayList<>(rows.values());
        all.sort(Comparator.comparingLong(row -> row.guildId().getValue()));
        return all;
    }

    /**
     * Makes every subsequent write fail (or succeed again).
     *
     * <p>This method is used for failure-path tests.</p>
     */
    public void failWrites(boolean fail) {
        writeFailure.set(fail);
    }

    /**
     * Makes every subsequent read fail (or succeed again).
     *
     * <p>This method is used for failure-path tests.</p>
     */
    public void failReads(boolean fail) {
        readFailure.set(fail);
    }

    /**
     * Returns the number of write operations that reached the rows (injected failures excluded).
     *
     * <p>This method is used for test assertions.</p>
     */
    public int getWriteCount() {
        return writeCount.get();
    }

    /**
     * Returns the number of stored rows.
     */
    public int size() {
        return rows.size();
    }

    /**
     * Clears all stored rows and resets failure injection.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        rows.clear();
        writeFailure.set(false);
        readFailure.set(false);
        writeCount.set(0);
    }

    private void checkWritable(GuildId guildId) {
        if (writeFailure.get()) {
            throw new StoreWriteException("Injected write failure", guildId);
        }
    }

    private void checkReadable(GuildId guildId) {
        if (readFailure.get()) {
            throw new StoreReadException("Injected read failure", guildId);
        }
    }
}
