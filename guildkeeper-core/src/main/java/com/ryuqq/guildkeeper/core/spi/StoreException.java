package com.ryuqq.guildkeeper.core.spi;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * Base type for {@link SettingsStore} failures.
 *
 * <p>Adapters translate their technology-specific exceptions (for example
 * Spring's {@code DataAccessException}) into one of the two subclasses so the
 * application layer can classify failures without knowing the adapter.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class StoreException extends RuntimeException {

    private final transient GuildId guildId;

    protected StoreException(String message, GuildId guildId, Throwable cause) {
        super(message, cause);
        this.guildId = guildId;
    }

    /**
     * Returns the guild the failed operation targeted.
     *
     * @return the guild, or null for bulk operations
     */
    public GuildId getGuildId() {
        return guildId;
    }
}
