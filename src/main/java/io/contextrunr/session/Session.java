package io.contextrunr.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single conversation session owned by exactly one user.
 *
 * <p>Not thread-safe. {@link SessionStore} mutates sessions only under the session's lock and
 * hands out {@link #copy() copies} to callers.</p>
 */
public class Session {

    static final String MESSAGE_COUNT = "message_count";

    private final String id;
    private final String userId;
    private final Instant createdAt;
    private Instant lastAccessed;
    private SessionStatus status;
    private final List<Message> history;
    private final Map<String, Object> metadata;

    public Session(String id, String userId, Instant createdAt, Instant lastAccessed,
                   SessionStatus status, List<Message> history, Map<String, Object> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Session owner is required");
        }
        this.id = id;
        this.userId = userId;
        this.createdAt = createdAt;
        this.lastAccessed = lastAccessed;
        this.status = status == null ? SessionStatus.ACTIVE : status;
        this.history = history == null ? new ArrayList<>() : new ArrayList<>(history);
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessed() {
        return lastAccessed;
    }

    public SessionStatus status() {
        return status;
    }

    public List<Message> history() {
        return List.copyOf(history);
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public int messageCount() {
        Object count = metadata.get(MESSAGE_COUNT);
        return count instanceof Number n ? n.intValue() : 0;
    }

    void touch(Instant now) {
        this.lastAccessed = now;
    }

    void append(Message message) {
        history.add(message);
        metadata.put(MESSAGE_COUNT, messageCount() + 1);
    }

    void replaceHistory(List<Message> retained) {
        history.clear();
        history.addAll(retained);
    }

    /**
     * Moves the session forward in its lifecycle.
     *
     * @throws IllegalStateException on a backward transition
     */
    void transitionTo(SessionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Session %s cannot move from %s to %s".formatted(id, status, next));
        }
        this.status = next;
    }

    /** Returns an independent copy, used to hand sessions out of the store. */
    public Session copy() {
        return new Session(id, userId, createdAt, lastAccessed, status, history, metadata);
    }

    @Override
    public String toString() {
        return "Session[id=%s, userId=%s, status=%s, messages=%d]".formatted(id, userId, status, history.size());
    }
}
