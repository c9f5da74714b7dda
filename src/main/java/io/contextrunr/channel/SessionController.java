package io.contextrunr.channel;

import io.contextrunr.core.ContextEngine;
import io.contextrunr.session.Message;
import io.contextrunr.storage.Timestamps;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST channel for session operations. The caller identifies the user with the
 * {@code X-User-Id} header; sessions of other users answer 404.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    static final String USER_HEADER = "X-User-Id";

    private final ContextEngine contextEngine;

    public SessionController(ContextEngine contextEngine) {
        this.contextEngine = contextEngine;
    }

    @PostMapping
    public ResponseEntity<SessionCreatedDto> create(@RequestBody CreateSessionDto request) {
        String sessionId = contextEngine.createSession(request.userId(), request.initialContext());
        return ResponseEntity.ok(new SessionCreatedDto(sessionId));
    }

    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<Void> append(@PathVariable String sessionId,
                                       @RequestHeader(USER_HEADER) String userId,
                                       @RequestBody MessageRequestDto request) {
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("Message content must not be blank");
        }
        boolean appended = contextEngine.append(sessionId, userId, request.role(), request.content());
        return appended ? ResponseEntity.accepted().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/{sessionId}/messages")
    public ResponseEntity<List<MessageDto>> history(@PathVariable String sessionId,
                                                    @RequestHeader(USER_HEADER) String userId,
                                                    @RequestParam(required = false) Integer limit) {
        if (!contextEngine.isAccessible(sessionId, userId)) {
            return ResponseEntity.notFound().build();
        }
        List<MessageDto> messages = contextEngine.history(sessionId, userId, limit).stream()
                .map(MessageDto::from)
                .toList();
        return ResponseEntity.ok(messages);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId,
                                    @RequestHeader(USER_HEADER) String userId) {
        return contextEngine.end(sessionId, userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    public record CreateSessionDto(String userId, String initialContext) {}

    public record SessionCreatedDto(String sessionId) {}

    public record MessageRequestDto(String role, String content) {}

    public record MessageDto(String id, String role, String content, String timestamp) {
        static MessageDto from(Message message) {
            return new MessageDto(message.id(), message.role().wireName(), message.content(),
                    Timestamps.format(message.timestamp()));
        }
    }
}
