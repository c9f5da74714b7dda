package io.contextrunr.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A single long-term memory owned by one user. Memories are never edited in place:
 * consolidation either keeps, merges away or prunes them.
 *
 * @param id              unique identifier, derived from generation time and owner
 * @param userId          the owning user
 * @param content         the remembered text
 * @param memoryType      declarative or procedural
 * @param importance      importance in [0.0, 1.0]
 * @param createdAt       when the memory was generated
 * @param lastAccessed    last access time, as recorded at generation
 * @param provenance      free-text origin tag (e.g. {@code conversation_etl})
 * @param tags            free-form labels
 * @param relatedMemories ids of related memories (soft references)
 */
public record Memory(
        String id,
        String userId,
        String content,
        MemoryType memoryType,
        double importance,
        Instant createdAt,
        Instant lastAccessed,
        String provenance,
        Set<String> tags,
        Set<String> relatedMemories
) {
    public Memory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Memory id is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Memory owner is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("Memory content is required");
        }
        if (memoryType == null) {
            throw new IllegalArgumentException("Memory type is required");
        }
        if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("Memory importance must be within [0, 1]: " + importance);
        }
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        relatedMemories = relatedMemories == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(relatedMemories));
    }

    /**
     * Generates a memory id from generation time and owner. Content plays no part,
     * so identical content yields distinct memories until consolidation merges them.
     */
    public static String newId(Instant generatedAt, String userId) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return "mem_%d_%s_%s".formatted(generatedAt.toEpochMilli(), userId, suffix);
    }
}
