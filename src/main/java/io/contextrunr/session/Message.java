package io.contextrunr.session;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A message in a session's history. Immutable; content is redacted once before first persistence.
 *
 * @param id            unique identifier ({@code msg_<uuid>})
 * @param role          the message role (SYSTEM, USER, ASSISTANT, TOOL)
 * @param content       the message content
 * @param timestamp     when the message was created
 * @param toolCalls     optional tool call payloads (empty when none)
 * @param toolResponses optional tool response payloads (empty when none)
 */
public record Message(
        String id,
        Role role,
        String content,
        Instant timestamp,
        List<Map<String, Object>> toolCalls,
        List<Map<String, Object>> toolResponses
) {
    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL;

        public static Role fromString(String s) {
            if (s == null || s.isBlank()) {
                throw new IllegalArgumentException("Message role is required");
            }
            return switch (s.trim().toLowerCase()) {
                case "system" -> SYSTEM;
                case "user" -> USER;
                case "assistant" -> ASSISTANT;
                case "tool" -> TOOL;
                default -> throw new IllegalArgumentException("Unknown message role: " + s);
            };
        }

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public Message {
        if (role == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("Message content is required");
        }
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResponses = toolResponses == null ? List.of() : List.copyOf(toolResponses);
    }

    public static Message of(Role role, String content, Instant timestamp) {
        return new Message(newId(), role, content, timestamp, null, null);
    }

    /** Creates a user message. */
    public static Message user(String content, Instant timestamp) {
        return of(Role.USER, content, timestamp);
    }

    /** Creates a system message. */
    public static Message system(String content, Instant timestamp) {
        return of(Role.SYSTEM, content, timestamp);
    }

    /** Creates an assistant message. */
    public static Message assistant(String content, Instant timestamp) {
        return of(Role.ASSISTANT, content, timestamp);
    }

    public Message withContent(String newContent) {
        return new Message(id, role, newContent, timestamp, toolCalls, toolResponses);
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }

    static String newId() {
        return "msg_" + UUID.randomUUID();
    }
}
