package com.ryuqq.guildkeeper.core.spi;

/**
 * Outbound calls to the chat platform gateway.
 *
 * <p>Both calls may block on network I/O. Callers must never hold the settings
 * cache lock while invoking them.</p>
 *
 * <p><strong>Failure Semantics:</strong></p>
 * <ul>
 *   <li>Implementations signal delivery failures with an unchecked exception</li>
 *   <li>The presence loop treats failures as best-effort and keeps running</li>
 *   <li>Command replies that fail to deliver are logged and do not change the command outcome</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Gateway {

    /**
     * Publishes the bot's presence (status) text.
     *
     * @param statusText the text shown as the bot's activity
     * @throws IllegalArgumentException if statusText is null
     */
    void setPresence(String statusText);

    /**
     * Sends a reply to a channel.
     *
     * @param channelId the target channel
     * @param content the reply body
     * @throws IllegalArgumentException if content is null
     */
    void sendReply(long channelId, String content);
}
