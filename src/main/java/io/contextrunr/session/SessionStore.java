package io.contextrunr.session;

import io.contextrunr.background.BackgroundTaskCoordinator;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.KeyedLocks;
import io.contextrunr.pii.PiiRedactor;
import io.contextrunr.storage.RecordCodec;
import io.contextrunr.storage.RecordStore;
import io.contextrunr.storage.StorageException;
import io.contextrunr.storage.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-term working memory: owns every session's history and lifecycle.
 *
 * <p>Key behaviors:</p>
 * <ul>
 *   <li>Sessions are visible only to their owner and only while active. A foreign or
 *       inactive session looks exactly like a missing one.</li>
 *   <li>Message content is redacted once, before the message is first persisted.</li>
 *   <li>History is truncated to the token budget after every append.</li>
 *   <li>All mutations of one session are serialized by a per-session lock.</li>
 *   <li>A session loaded on a cache miss has its refreshed access time written back in the
 *       background, unless a later write or eviction superseded it first.</li>
 * </ul>
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    static final String KEY_PREFIX = "session:";

    private final RecordStore recordStore;
    private final RecordCodec codec;
    private final PiiRedactor piiRedactor;
    private final ContextWindow contextWindow;
    private final Clock clock;
    private final BackgroundTaskCoordinator coordinator;
    private final boolean redactionEnabled;
    private final int ttlDays;

    private final Map<String, Session> cache = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();

    public SessionStore(RecordStore recordStore, RecordCodec codec, PiiRedactor piiRedactor,
                        ContextProperties properties, Clock clock,
                        BackgroundTaskCoordinator coordinator) {
        this.recordStore = recordStore;
        this.codec = codec;
        this.piiRedactor = piiRedactor;
        this.contextWindow = new ContextWindow(properties.session().maxTokenLimit());
        this.clock = clock;
        this.coordinator = coordinator;
        this.redactionEnabled = properties.session().piiRedactionEnabled();
        this.ttlDays = properties.session().ttlDays();
    }

    /**
     * Creates a new active session, seeded with a system message when an initial context is given.
     *
     * @throws IllegalArgumentException if the user id is blank
     * @throws StorageException         if the session cannot be persisted
     */
    public Session createSession(String userId, String initialContext) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }

        Instant now = now();
        String sessionId = "session_" + UUID.randomUUID();
        List<Message> initialMessages = (initialContext == null || initialContext.isBlank())
                ? List.of()
                : List.of(Message.system(initialContext, now));

        Session session = new Session(sessionId, userId, now, now, SessionStatus.ACTIVE, initialMessages, Map.of());
        persist(session);
        cache.put(sessionId, session);

        log.info("Created session {} for user {}", sessionId, userId);
        return session.copy();
    }

    /**
     * Returns the session if it exists, belongs to the user and is active.
     */
    public Optional<Session> getSession(String sessionId, String userId) {
        return loadAccessible(sessionId, userId, true).map(Session::copy);
    }

    /**
     * Appends a message after redacting it, then enforces the token budget.
     *
     * @return false if the session is not accessible or could not be persisted
     * @throws IllegalArgumentException if the message is null
     */
    public boolean addMessage(String sessionId, String userId, Message message) {
        return appendMessage(sessionId, userId, message).isPresent();
    }

    /**
     * Like {@link #addMessage}, but returns the session as persisted by this append, so callers
     * see the message count and history of exactly this turn.
     *
     * @return the updated session, or empty if the session is not accessible or could not be persisted
     * @throws IllegalArgumentException if the message is null
     */
    public Optional<Session> appendMessage(String sessionId, String userId, Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }

        return locks.withLock(sessionId, () -> {
            Optional<Session> current = loadAccessible(sessionId, userId, false);
            if (current.isEmpty()) {
                log.debug("Rejected message for inaccessible session {}", sessionId);
                return Optional.empty();
            }

            Session updated = current.get().copy();
            updated.append(redact(message));
            updated.replaceHistory(contextWindow.fit(updated.history()));
            updated.touch(now());

            try {
                persist(updated);
            } catch (StorageException e) {
                log.error("Failed to persist message for session {}", sessionId, e);
                return Optional.empty();
            }
            cache.put(sessionId, updated);
            return Optional.of(updated.copy());
        });
    }

    /**
     * Returns the most recent {@code limit} messages, or the full history when limit is null or not positive.
     */
    public List<Message> getHistory(String sessionId, String userId, Integer limit) {
        Optional<Session> session = loadAccessible(sessionId, userId, true);
        if (session.isEmpty()) {
            return List.of();
        }
        List<Message> history = session.get().history();
        if (limit != null && limit > 0 && limit < history.size()) {
            return List.copyOf(history.subList(history.size() - limit, history.size()));
        }
        return history;
    }

    /**
     * Marks a session inactive and evicts it from the cache.
     *
     * @return false if the session is not accessible or could not be persisted
     */
    public boolean endSession(String sessionId, String userId) {
        return locks.withLock(sessionId, () -> {
            Optional<Session> current = loadAccessible(sessionId, userId, false);
            if (current.isEmpty()) {
                return false;
            }

            Session ended = current.get().copy();
            ended.transitionTo(SessionStatus.INACTIVE);
            ended.touch(now());
            cache.remove(sessionId);

            try {
                persist(ended);
            } catch (StorageException e) {
                log.error("Failed to persist end of session {}", sessionId, e);
                return false;
            }
            log.info("Ended session {}", sessionId);
            return true;
        });
    }

    /**
     * Archives sessions idle for longer than the configured TTL.
     */
    public int sweepExpired() {
        return sweepExpired(now(), ttlDays);
    }

    /**
     * Archives every session whose last access precedes {@code now - ttlDays}.
     * A session that fails to load or save is logged and skipped.
     *
     * @return number of sessions archived
     */
    public int sweepExpired(Instant now, int ttlDays) {
        Instant cutoff = now.minus(Duration.ofDays(ttlDays));

        List<String> keys;
        try {
            keys = recordStore.scan(KEY_PREFIX);
        } catch (StorageException e) {
            log.error("Session sweep could not list sessions", e);
            return 0;
        }

        int archived = 0;
        for (String key : keys) {
            String sessionId = key.substring(KEY_PREFIX.length());
            try {
                if (archiveIfExpired(sessionId, cutoff)) {
                    archived++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to sweep session {}: {}", sessionId, e.getMessage());
            }
        }

        log.info("Session sweep archived {} of {} sessions (cutoff {})", archived, keys.size(), cutoff);
        return archived;
    }

    private boolean archiveIfExpired(String sessionId, Instant cutoff) {
        return locks.withLock(sessionId, () -> {
            Session cached = cache.get(sessionId);
            Session session = cached != null ? cached.copy() : fetch(sessionId).orElse(null);
            if (session == null
                    || session.status() == SessionStatus.ARCHIVED
                    || !session.lastAccessed().isBefore(cutoff)) {
                return false;
            }

            session.transitionTo(SessionStatus.ARCHIVED);
            persist(session);
            cache.remove(sessionId);
            log.debug("Archived session {}", sessionId);
            return true;
        });
    }

    /**
     * @param writeBack whether a cache miss persists the refreshed access time; callers that
     *                  persist the session themselves pass false
     */
    private Optional<Session> loadAccessible(String sessionId, String userId, boolean writeBack) {
        if (sessionId == null || userId == null) {
            return Optional.empty();
        }

        Session cached = cache.get(sessionId);
        if (cached != null) {
            return isAccessible(cached, userId) ? Optional.of(cached) : Optional.empty();
        }
        // cache misses load under the lock so a concurrent append or end is never overwritten
        return locks.withLock(sessionId, () -> loadIntoCache(sessionId, userId, writeBack));
    }

    private Optional<Session> loadIntoCache(String sessionId, String userId, boolean writeBack) {
        Session cached = cache.get(sessionId);
        if (cached != null) {
            return isAccessible(cached, userId) ? Optional.of(cached) : Optional.empty();
        }

        Optional<Session> stored;
        try {
            stored = fetch(sessionId);
        } catch (StorageException e) {
            log.error("Failed to load session {}", sessionId, e);
            return Optional.empty();
        }
        if (stored.isEmpty() || !isAccessible(stored.get(), userId)) {
            return Optional.empty();
        }

        Session session = stored.get();
        session.touch(now());
        cache.put(sessionId, session);
        if (writeBack) {
            scheduleWriteBack(session);
        }
        return Optional.of(session);
    }

    private boolean isAccessible(Session session, String userId) {
        return session.isOwnedBy(userId) && session.isActive();
    }

    private Message redact(Message message) {
        if (!redactionEnabled) {
            return message;
        }
        return message.withContent(piiRedactor.redact(message.content()));
    }

    /**
     * Persists the access time of a freshly cached session. Runs under the session lock and
     * only while that exact instance is still cached: any append replaces it, and ending or
     * archiving evicts it, so a stale snapshot never overwrites newer state.
     */
    private void scheduleWriteBack(Session cached) {
        String sessionId = cached.id();
        Session snapshot = cached.copy();
        coordinator.runDetached("write-back of session " + sessionId, () -> locks.withLock(sessionId, () -> {
            if (cache.get(sessionId) != cached || !snapshot.isActive()) {
                log.debug("Skipped superseded write-back of session {}", sessionId);
                return null;
            }
            persist(snapshot);
            return null;
        }));
    }

    private Optional<Session> fetch(String sessionId) {
        return recordStore.get(KEY_PREFIX + sessionId).map(codec::decodeSession);
    }

    private void persist(Session session) {
        recordStore.set(KEY_PREFIX + session.id(), codec.encodeSession(session));
    }

    private Instant now() {
        return Timestamps.truncate(clock.instant());
    }
}
