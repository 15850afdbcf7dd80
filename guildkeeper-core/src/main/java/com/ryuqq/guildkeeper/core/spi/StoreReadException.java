package com.ryuqq.guildkeeper.core.spi;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * A durable read failed (point lookup or startup load).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreReadException extends StoreException {

    public StoreReadException(String message, GuildId guildId, Throwable cause) {
        super(message, guildId, cause);
    }

    public StoreReadException(String message, GuildId guildId) {
        super(message, guildId, null);
    }
}
