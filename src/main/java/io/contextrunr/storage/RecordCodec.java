package io.contextrunr.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextrunr.memory.Memory;
import io.contextrunr.memory.MemoryType;
import io.contextrunr.session.Message;
import io.contextrunr.session.Session;
import io.contextrunr.session.SessionStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned JSON encoding of persisted records.
 *
 * <p>Every document is self-describing:</p>
 * <pre>
 * {"kind": "session", "schemaVersion": 1, "id": "session_...", "user_id": "...", ...}
 * {"kind": "memory",  "schemaVersion": 1, "id": "mem_...",     "user_id": "...", ...}
 * </pre>
 *
 * <p>Documents written by a newer schema version are rejected with
 * {@link RecordFormatException} instead of being half-read.</p>
 */
@Component
public class RecordCodec {

    public static final int SCHEMA_VERSION = 1;
    static final String KIND_SESSION = "session";
    static final String KIND_MEMORY = "memory";

    private static final TypeReference<List<Map<String, Object>>> PAYLOADS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    public String encodeSession(Session session) {
        ObjectNode root = header(KIND_SESSION);
        root.put("id", session.id());
        root.put("user_id", session.userId());
        root.put("created_at", Timestamps.format(session.createdAt()));
        root.put("last_accessed", Timestamps.format(session.lastAccessed()));
        root.put("status", session.status().wireName());

        ArrayNode history = root.putArray("history");
        for (Message message : session.history()) {
            ObjectNode node = history.addObject();
            node.put("id", message.id());
            node.put("role", message.role().wireName());
            node.put("content", message.content());
            node.put("timestamp", Timestamps.format(message.timestamp()));
            node.set("tool_calls", mapper.valueToTree(message.toolCalls()));
            node.set("tool_responses", mapper.valueToTree(message.toolResponses()));
        }

        root.set("metadata", mapper.valueToTree(session.metadata()));
        return write(root);
    }

    public Session decodeSession(String document) {
        JsonNode root = read(document, KIND_SESSION);

        try {
            List<Message> history = new ArrayList<>();
            for (JsonNode node : root.path("history")) {
                history.add(new Message(
                        text(node, "id"),
                        Message.Role.fromString(text(node, "role")),
                        text(node, "content"),
                        Timestamps.parse(text(node, "timestamp")),
                        payloads(node.get("tool_calls")),
                        payloads(node.get("tool_responses"))
                ));
            }

            Map<String, Object> metadata = root.hasNonNull("metadata")
                    ? mapper.convertValue(root.get("metadata"), METADATA)
                    : Map.of();

            return new Session(
                    text(root, "id"),
                    text(root, "user_id"),
                    Timestamps.parse(text(root, "created_at")),
                    Timestamps.parse(text(root, "last_accessed")),
                    SessionStatus.fromString(text(root, "status")),
                    history,
                    metadata
            );
        } catch (IllegalArgumentException e) {
            throw new RecordFormatException("Invalid session record: " + e.getMessage(), e);
        }
    }

    public String encodeMemory(Memory memory) {
        ObjectNode root = header(KIND_MEMORY);
        root.put("id", memory.id());
        root.put("user_id", memory.userId());
        root.put("content", memory.content());
        root.put("memory_type", memory.memoryType().wireName());
        root.put("importance", memory.importance());
        root.put("created_at", Timestamps.format(memory.createdAt()));
        root.put("last_accessed", Timestamps.format(memory.lastAccessed()));
        root.put("provenance", memory.provenance());
        ArrayNode tags = root.putArray("tags");
        memory.tags().forEach(tags::add);
        ArrayNode related = root.putArray("related_memories");
        memory.relatedMemories().forEach(related::add);
        return write(root);
    }

    public Memory decodeMemory(String document) {
        JsonNode root = read(document, KIND_MEMORY);
        try {
            return new Memory(
                    text(root, "id"),
                    text(root, "user_id"),
                    text(root, "content"),
                    MemoryType.fromString(text(root, "memory_type")),
                    root.path("importance").asDouble(),
                    Timestamps.parse(text(root, "created_at")),
                    Timestamps.parse(text(root, "last_accessed")),
                    root.path("provenance").asText(null),
                    strings(root.get("tags")),
                    strings(root.get("related_memories"))
            );
        } catch (IllegalArgumentException e) {
            throw new RecordFormatException("Invalid memory record: " + e.getMessage(), e);
        }
    }

    private ObjectNode header(String kind) {
        ObjectNode root = mapper.createObjectNode();
        root.put("kind", kind);
        root.put("schemaVersion", SCHEMA_VERSION);
        return root;
    }

    private JsonNode read(String document, String expectedKind) {
        JsonNode root;
        try {
            root = mapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException("Malformed %s record".formatted(expectedKind), e);
        }
        if (root == null || !root.isObject()) {
            throw new RecordFormatException("Malformed %s record: not a JSON object".formatted(expectedKind));
        }

        String kind = root.path("kind").asText("");
        if (!expectedKind.equals(kind)) {
            throw new RecordFormatException("Expected a %s record but found kind '%s'".formatted(expectedKind, kind));
        }
        int version = root.path("schemaVersion").asInt(0);
        if (version < 1 || version > SCHEMA_VERSION) {
            throw new RecordFormatException("Unsupported %s schema version %d (this build reads up to %d)"
                    .formatted(expectedKind, version, SCHEMA_VERSION));
        }
        return root;
    }

    private String write(ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode " + root.path("kind").asText() + " record", e);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new RecordFormatException("Missing field '" + field + "'");
        }
        return value.asText();
    }

    private List<Map<String, Object>> payloads(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        return mapper.convertValue(node, PAYLOADS);
    }

    private Set<String> strings(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (node != null) {
            node.forEach(n -> values.add(n.asText()));
        }
        return values;
    }
}
