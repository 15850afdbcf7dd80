package com.ryuqq.guildkeeper.core.spi;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * A durable insert, update or delete failed.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreWriteException extends StoreException {

    public StoreWriteException(String message, GuildId guildId, Throwable cause) {
        super(message, guildId, cause);
    }

    public StoreWriteException(String message, GuildId guildId) {
        super(message, guildId, null);
    }
}
