package io.contextrunr.storage;

import io.contextrunr.memory.Memory;
import io.contextrunr.memory.MemoryType;
import io.contextrunr.session.Message;
import io.contextrunr.session.Session;
import io.contextrunr.session.SessionStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    private static final Instant T0 = Instant.parse("2026-02-28T09:15:00.123Z");

    private final RecordCodec codec = new RecordCodec();

    @Test
    void shouldEncodeSessionWithHeaderAndSnakeCaseFields() {
        Session session = new Session("session_1", "alice", T0, T0, SessionStatus.ACTIVE,
                List.of(Message.user("hello", T0)), Map.of("message_count", 1));

        String json = codec.encodeSession(session);

        assertTrue(json.contains("\"kind\":\"session\""));
        assertTrue(json.contains("\"schemaVersion\":1"));
        assertTrue(json.contains("\"user_id\":\"alice\""));
        assertTrue(json.contains("\"last_accessed\":\"2026-02-28T09:15:00.123Z\""));
        assertTrue(json.contains("\"status\":\"active\""));
    }

    @Test
    void shouldDecodeSessionIncludingToolPayloads() {
        Message toolMessage = new Message("msg_1", Message.Role.TOOL, "42", T0,
                List.of(Map.of("name", "lookup")), List.of(Map.of("result", "ok")));
        Session session = new Session("session_1", "alice", T0, T0.plusSeconds(5), SessionStatus.INACTIVE,
                List.of(toolMessage), Map.of("message_count", 3));

        Session decoded = codec.decodeSession(codec.encodeSession(session));

        assertEquals("session_1", decoded.id());
        assertEquals("alice", decoded.userId());
        assertEquals(T0.plusSeconds(5), decoded.lastAccessed());
        assertEquals(SessionStatus.INACTIVE, decoded.status());
        assertEquals(3, decoded.messageCount());
        Message message = decoded.history().get(0);
        assertEquals(Message.Role.TOOL, message.role());
        assertEquals("lookup", message.toolCalls().get(0).get("name"));
        assertEquals("ok", message.toolResponses().get(0).get("result"));
    }

    @Test
    void shouldDecodeMemory() {
        Memory memory = new Memory("mem_1", "alice", "Prefers tea", MemoryType.DECLARATIVE, 0.75,
                T0, T0, "conversation_etl", Set.of("drinks"), Set.of("mem_0"));

        Memory decoded = codec.decodeMemory(codec.encodeMemory(memory));

        assertEquals(memory, decoded);
    }

    @Test
    void shouldRejectFutureSchemaVersion() {
        String json = codec.encodeMemory(new Memory("mem_1", "alice", "x", MemoryType.DECLARATIVE, 0.5,
                T0, T0, null, null, null)).replace("\"schemaVersion\":1", "\"schemaVersion\":2");

        RecordFormatException e = assertThrows(RecordFormatException.class, () -> codec.decodeMemory(json));
        assertTrue(e.getMessage().contains("schema version 2"));
    }

    @Test
    void shouldRejectWrongKind() {
        Session session = new Session("session_1", "alice", T0, T0, SessionStatus.ACTIVE, List.of(), Map.of());

        assertThrows(RecordFormatException.class, () -> codec.decodeMemory(codec.encodeSession(session)));
    }

    @Test
    void shouldRejectMalformedDocument() {
        assertThrows(RecordFormatException.class, () -> codec.decodeSession("{not json"));
        assertThrows(RecordFormatException.class, () -> codec.decodeSession("[]"));
    }

    @Test
    void shouldRejectUnknownMessageRole() {
        Session session = new Session("session_1", "alice", T0, T0, SessionStatus.ACTIVE,
                List.of(Message.user("hello", T0)), Map.of());
        String json = codec.encodeSession(session).replace("\"role\":\"user\"", "\"role\":\"narrator\"");

        RecordFormatException e = assertThrows(RecordFormatException.class, () -> codec.decodeSession(json));
        assertTrue(e.getMessage().contains("narrator"));
    }

    @Test
    void shouldRejectMissingField() {
        String json = "{\"kind\":\"memory\",\"schemaVersion\":1,\"id\":\"mem_1\"}";

        assertThrows(RecordFormatException.class, () -> codec.decodeMemory(json));
    }

    @Test
    void shouldRejectOutOfRangeImportance() {
        String json = codec.encodeMemory(new Memory("mem_1", "alice", "x", MemoryType.DECLARATIVE, 0.5,
                T0, T0, null, null, null)).replace("\"importance\":0.5", "\"importance\":1.5");

        assertThrows(RecordFormatException.class, () -> codec.decodeMemory(json));
    }

    @Test
    void shouldFormatTimestampsWithFixedWidth() {
        assertEquals("2026-01-02T03:04:05.000Z", Timestamps.format(Instant.parse("2026-01-02T03:04:05Z")));
        assertEquals(Instant.parse("2026-01-02T03:04:05.007Z"), Timestamps.parse("2026-01-02T03:04:05.007Z"));
        assertThrows(RecordFormatException.class, () -> Timestamps.parse("yesterday"));
    }
}
