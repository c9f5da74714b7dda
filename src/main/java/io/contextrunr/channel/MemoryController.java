package io.contextrunr.channel;

import io.contextrunr.core.ContextEngine;
import io.contextrunr.memory.Memory;
import io.contextrunr.storage.Timestamps;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST channel for long-term memory.
 */
@RestController
@RequestMapping("/api/memories")
public class MemoryController {

    private final ContextEngine contextEngine;

    public MemoryController(ContextEngine contextEngine) {
        this.contextEngine = contextEngine;
    }

    /**
     * Lists the user's memories, or ranks them against a query when one is given.
     */
    @GetMapping
    public ResponseEntity<List<MemoryDto>> list(@RequestHeader(SessionController.USER_HEADER) String userId,
                                                @RequestParam(required = false) String query,
                                                @RequestParam(required = false) Integer topK) {
        List<Memory> memories = (query == null || query.isBlank())
                ? contextEngine.memories(userId)
                : contextEngine.retrieveContext(userId, query, topK);
        return ResponseEntity.ok(memories.stream().map(MemoryDto::from).toList());
    }

    /**
     * Prompt-ready memory block for a query.
     */
    @GetMapping("/context")
    public ResponseEntity<Map<String, String>> context(@RequestHeader(SessionController.USER_HEADER) String userId,
                                                       @RequestParam String query,
                                                       @RequestParam(required = false) Integer topK) {
        List<Memory> memories = contextEngine.retrieveContext(userId, query, topK);
        return ResponseEntity.ok(Map.of("context", contextEngine.formatMemoryContext(memories)));
    }

    @PostMapping("/extract")
    public ResponseEntity<Map<String, String>> extract(@RequestHeader(SessionController.USER_HEADER) String userId,
                                                       @RequestBody ExtractRequestDto request) {
        return contextEngine.fromTranscript(userId, request.transcript(), request.topics())
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(Map.of("memoryId", id)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/consolidate")
    public ResponseEntity<Void> consolidate(@RequestHeader(SessionController.USER_HEADER) String userId) {
        return contextEngine.consolidate(userId)
                ? ResponseEntity.accepted().build()
                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    /**
     * Deletes one of the caller's memories. Unknown ids and ids owned by other users both answer 204.
     */
    @DeleteMapping("/{memoryId}")
    public ResponseEntity<Void> delete(@RequestHeader(SessionController.USER_HEADER) String userId,
                                       @PathVariable String memoryId) {
        return contextEngine.forget(userId, memoryId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    public record ExtractRequestDto(String transcript, List<String> topics) {}

    public record MemoryDto(String id, String content, String memoryType, double importance,
                            String createdAt, String provenance) {
        static MemoryDto from(Memory memory) {
            return new MemoryDto(memory.id(), memory.content(), memory.memoryType().wireName(),
                    memory.importance(), Timestamps.format(memory.createdAt()), memory.provenance());
        }
    }
}
