package io.contextrunr.core;

import io.contextrunr.background.BackgroundTaskCoordinator;
import io.contextrunr.config.ContextProperties;
import io.contextrunr.memory.Memory;
import io.contextrunr.memory.MemoryStore;
import io.contextrunr.session.Message;
import io.contextrunr.session.Session;
import io.contextrunr.session.SessionStore;
import io.contextrunr.storage.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for agent adapters. Ties the session store, the memory store and
 * background memory generation together.
 *
 * <p>Typical turn:</p>
 * <ol>
 *   <li>{@link #retrieveContext} to enrich the prompt with the user's memories</li>
 *   <li>{@link #append} the user message, then the assistant reply; each successful append of a
 *       user or assistant message schedules memory generation from the session transcript</li>
 * </ol>
 */
@Service
public class ContextEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextEngine.class);

    private final SessionStore sessionStore;
    private final MemoryStore memoryStore;
    private final BackgroundTaskCoordinator coordinator;
    private final ContextProperties properties;
    private final Clock clock;

    public ContextEngine(SessionStore sessionStore, MemoryStore memoryStore,
                         BackgroundTaskCoordinator coordinator, ContextProperties properties, Clock clock) {
        this.sessionStore = sessionStore;
        this.memoryStore = memoryStore;
        this.coordinator = coordinator;
        this.properties = properties;
        this.clock = clock;
    }

    public String createSession(String userId, String initialContext) {
        return sessionStore.createSession(userId, initialContext).id();
    }

    /**
     * Appends a message to a session.
     *
     * @param role "system", "user", "assistant" or "tool"
     * @return false if the session is not accessible or the write failed
     * @throws IllegalArgumentException on an unknown role or missing content
     */
    public boolean append(String sessionId, String userId, String role, String content) {
        Message message = Message.of(Message.Role.fromString(role), content, Timestamps.truncate(clock.instant()));
        Optional<Session> updated = sessionStore.appendMessage(sessionId, userId, message);
        if (updated.isEmpty()) {
            return false;
        }

        if (message.role() == Message.Role.USER || message.role() == Message.Role.ASSISTANT) {
            scheduleGeneration(updated.get());
        }
        return true;
    }

    /**
     * True when the session exists, belongs to the user and is active.
     */
    public boolean isAccessible(String sessionId, String userId) {
        return sessionStore.getSession(sessionId, userId).isPresent();
    }

    public List<Message> history(String sessionId, String userId, Integer limit) {
        return sessionStore.getHistory(sessionId, userId, limit);
    }

    public boolean end(String sessionId, String userId) {
        return sessionStore.endSession(sessionId, userId);
    }

    /**
     * Memories of both types above the configured importance threshold, best first.
     *
     * @param topK maximum results, or null for the configured default
     */
    public List<Memory> retrieveContext(String userId, String query, Integer topK) {
        int limit = topK == null || topK <= 0 ? properties.memory().maxMemoriesPerQuery() : topK;
        return memoryStore.retrieve(userId, query, limit, null, properties.memory().importanceThreshold(), null);
    }

    /**
     * Generates a memory synchronously from a transcript.
     *
     * @param topics topic definitions, or null for the configured ones
     * @return the new memory id
     */
    public Optional<String> fromTranscript(String userId, String transcriptText, List<String> topics) {
        List<String> topicDefinitions = topics == null || topics.isEmpty() ? properties.memory().topics() : topics;
        return memoryStore.generateMemory(userId, transcriptText, topicDefinitions).map(Memory::id);
    }

    public List<Memory> memories(String userId) {
        return memoryStore.listForUser(userId);
    }

    public boolean consolidate(String userId) {
        return memoryStore.consolidate(userId);
    }

    /**
     * Deletes one of the user's memories. Ids of other users' memories are ignored.
     */
    public boolean forget(String userId, String memoryId) {
        return memoryStore.remove(userId, memoryId);
    }

    /**
     * Renders memories as a prompt block, or an empty string when there are none.
     */
    public String formatMemoryContext(List<Memory> memories) {
        if (memories == null || memories.isEmpty()) {
            return "";
        }
        return memories.stream()
                .map(m -> String.format(Locale.ROOT, "- %s (importance: %.2f)", m.content(), m.importance()))
                .collect(Collectors.joining("\n", "Relevant user memories:\n", "\n"));
    }

    /**
     * Schedules generation for the turn just appended. The turn number comes from the session
     * as persisted by that append, so concurrent appends never share a job id.
     */
    private void scheduleGeneration(Session session) {
        log.debug("Scheduling memory generation for session {} turn {}", session.id(), session.messageCount());
        coordinator.scheduleMemoryGeneration(session.id(), session.messageCount(), session.userId(),
                transcriptOf(session.history()), properties.memory().topics());
    }

    static String transcriptOf(List<Message> history) {
        return history.stream()
                .filter(m -> m.role() == Message.Role.USER || m.role() == Message.Role.ASSISTANT)
                .map(Message::content)
                .collect(Collectors.joining(" "));
    }
}
