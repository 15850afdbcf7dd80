package com.ryuqq.guildkeeper.adapter.inmemory.gateway;

import com.ryuqq.guildkeeper.core.spi.Gateway;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of {@link Gateway} SPI that records every outbound call.
 *
 * <p>Presence updates and replies are appended to {@link CopyOnWriteArrayList}s so
 * tests can read them while background loops keep publishing.</p>
 *
 * <p><strong>Failure Injection:</strong></p>
 * <ul>
 *   <li>{@link #failPresence(boolean)} - {@code setPresence} throws {@link IllegalStateException}</li>
 *   <li>{@link #failReplies(boolean)} - {@code sendReply} throws {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryGateway implements Gateway {

    private final CopyOnWriteArrayList<String> presences = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Reply> replies = new CopyOnWriteArrayList<>();
    private final AtomicBoolean presenceFailure = new AtomicBoolean(false);
    private final AtomicBoolean replyFailure = new AtomicBoolean(false);

    /**
     * A reply recorded by {@link #sendReply(long, String)}.
     *
     * @param channelId target channel
     * @param content reply text
     */
    public record Reply(long channelId, String content) {
    }

    @Override
    public void setPresence(String statusText) {
        if (statusText == null) {
            throw new IllegalArgumentException("statusText cannot be null");
        }
        if (presenceFailure.get()) {
            throw new IllegalStateException("Injected presence failure");
        }
        presences.add(statusText);
    }

    @Override
    public void sendReply(long channelId, String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (replyFailure.get()) {
            throw new IllegalStateException("Injected reply failure");
        }
        replies.add(new Reply(channelId, content));
    }

    public void failPresence(boolean fail) {
        presenceFailure.set(fail);
    }

    public void failReplies(boolean fail) {
        replyFailure.set(fail);
    }

    /**
     * @return every presence text published so far, oldest first
     */
    public List<String> getPresences() {
        return List.copyOf(presences);
    }

    public Optional<String> lastPresence() {
        if (presences.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(presences.get(presences.size() - 1));
    }

    /**
     * @return every reply sent so far, oldest first
     */
    public List<Reply> getReplies() {
        return List.copyOf(replies);
    }

    public Optional<Reply> lastReply() {
        if (replies.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(replies.get(replies.size() - 1));
    }

    /**
     * Clears recorded calls and resets failure injection.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        presences.clear();
        replies.clear();
        presenceFailure.set(false);
        replyFailure.set(false);
    }
}
