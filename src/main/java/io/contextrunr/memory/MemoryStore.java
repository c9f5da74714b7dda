package io.contextrunr.memory;

import io.contextrunr.config.ContextProperties;
import io.contextrunr.core.KeyedLocks;
import io.contextrunr.storage.RecordCodec;
import io.contextrunr.storage.RecordStore;
import io.contextrunr.storage.StorageException;
import io.contextrunr.storage.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Long-term memory: per-user records generated from conversations, retrieved by blended
 * score and periodically consolidated.
 *
 * <p>Every memory is written to the durable record store first and then to each configured
 * {@link MemoryRetrievalBackend}. A backend failure never fails the write; the durable record
 * remains the source of truth.</p>
 *
 * <p>Retrieval results are cached per query and tagged with the owner's generation counter.
 * Any write or removal for a user bumps the counter, so the next retrieval recomputes.</p>
 */
@Service
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    static final String KEY_PREFIX = "memory:";
    static final String PROVENANCE = "conversation_etl";
    static final double PRUNE_IMPORTANCE_BELOW = 0.3;
    static final Duration PRUNE_AGE = Duration.ofDays(30);
    static final int CANDIDATE_MULTIPLIER = 3;

    private final RecordStore recordStore;
    private final RecordCodec codec;
    private final List<MemoryRetrievalBackend> backends;
    private final ContentExtractor extractor;
    private final SimilarityStrategy similarity;
    private final ConflictResolver conflictResolver;
    private final Clock clock;
    private final Executor backendExecutor;
    private final long backendTimeoutSeconds;

    private final KeyedLocks userLocks = new KeyedLocks();
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    private final Map<QueryKey, CachedResult> queryCache = new ConcurrentHashMap<>();

    @Autowired
    public MemoryStore(RecordStore recordStore, RecordCodec codec,
                       ObjectProvider<MemoryRetrievalBackend> backends,
                       ContentExtractor extractor, SimilarityStrategy similarity,
                       ConflictResolver conflictResolver, Clock clock, ContextProperties properties,
                       @Qualifier("contextTaskExecutor") Executor backendExecutor) {
        this(recordStore, codec, backends.orderedStream().toList(), extractor, similarity,
                conflictResolver, clock, properties, backendExecutor);
    }

    public MemoryStore(RecordStore recordStore, RecordCodec codec, List<MemoryRetrievalBackend> backends,
                       ContentExtractor extractor, SimilarityStrategy similarity,
                       ConflictResolver conflictResolver, Clock clock, ContextProperties properties,
                       Executor backendExecutor) {
        this.recordStore = recordStore;
        this.codec = codec;
        this.backends = List.copyOf(backends);
        this.extractor = extractor;
        this.similarity = similarity;
        this.conflictResolver = conflictResolver;
        this.clock = clock;
        this.backendExecutor = backendExecutor;
        this.backendTimeoutSeconds = properties.memory().backendTimeoutSeconds();
        log.info("MemoryStore using {} retrieval backend(s): {}", this.backends.size(),
                this.backends.stream().map(MemoryRetrievalBackend::name).toList());
    }

    /**
     * Extracts, classifies, weighs and stores a memory from a conversation transcript.
     *
     * @return the stored memory, or empty when nothing relevant was found or storing failed
     */
    public Optional<Memory> generateMemory(String userId, String conversationText, List<String> topicDefinitions) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }

        Optional<String> extracted;
        try {
            extracted = extractor.extract(conversationText, topicDefinitions);
        } catch (RuntimeException e) {
            log.warn("Memory extraction failed for user {}: {}", userId, e.getMessage());
            return Optional.empty();
        }
        if (extracted.isEmpty() || extracted.get().isBlank()) {
            log.debug("No memory-worthy content for user {}", userId);
            return Optional.empty();
        }

        String content = extracted.get();
        Instant now = now();
        Memory memory = new Memory(
                Memory.newId(now, userId),
                userId,
                content,
                MemoryScoring.classify(content),
                MemoryScoring.assessImportance(content),
                now,
                now,
                PROVENANCE,
                Set.of(),
                Set.of()
        );

        boolean stored = userLocks.withLock(userId, () -> store(memory));
        if (!stored) {
            return Optional.empty();
        }
        log.info("Generated {} memory {} for user {} (importance {})",
                memory.memoryType().wireName(), memory.id(), userId, "%.2f".formatted(memory.importance()));
        return Optional.of(memory);
    }

    /**
     * Persists a memory durably, then indexes it in every retrieval backend.
     *
     * @return false if the memory is missing or the durable write failed
     */
    public boolean store(Memory memory) {
        if (memory == null) {
            return false;
        }

        try {
            recordStore.set(KEY_PREFIX + memory.id(), codec.encodeMemory(memory));
        } catch (StorageException e) {
            log.error("Failed to store memory {}", memory.id(), e);
            return false;
        }

        for (MemoryRetrievalBackend backend : backends) {
            try {
                backend.index(memory);
            } catch (RuntimeException e) {
                log.warn("Backend {} failed to index memory {}: {}", backend.name(), memory.id(), e.getMessage());
            }
        }

        invalidate(memory.userId());
        return true;
    }

    /**
     * Returns the user's memories best matching a query.
     *
     * @param memoryTypes   types to include, or null/empty for all
     * @param minImportance minimum importance
     * @param maxAgeDays    maximum age in whole days, or null for no limit
     */
    public List<Memory> retrieve(String userId, String query, int topK, Set<MemoryType> memoryTypes,
                                 double minImportance, Integer maxAgeDays) {
        if (userId == null || userId.isBlank() || topK <= 0) {
            return List.of();
        }

        Set<MemoryType> types = (memoryTypes == null || memoryTypes.isEmpty())
                ? EnumSet.allOf(MemoryType.class)
                : EnumSet.copyOf(memoryTypes);
        QueryKey key = new QueryKey(userId, query == null ? "" : query, topK, types, minImportance, maxAgeDays);

        long generation = generation(userId);
        CachedResult cached = queryCache.get(key);
        if (cached != null && cached.generation() == generation) {
            log.debug("Query cache hit for user {}", userId);
            return cached.memories();
        }

        Instant now = now();
        List<Scored> ranked = new ArrayList<>();
        for (ScoredMemory candidate : gatherCandidates(userId, key.query(), topK)) {
            Memory memory = candidate.memory();
            if (!memory.userId().equals(userId)
                    || !types.contains(memory.memoryType())
                    || memory.importance() < minImportance) {
                continue;
            }
            Duration age = Duration.between(memory.createdAt(), now);
            if (maxAgeDays != null && age.toDays() > maxAgeDays) {
                continue;
            }
            double score = MemoryScoring.blendedScore(memory.importance(), candidate.relevance(),
                    MemoryScoring.recency(age));
            ranked.add(new Scored(memory, score));
        }

        // List.sort is stable, equal scores keep candidate order
        ranked.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<Memory> results = ranked.stream()
                .limit(topK)
                .map(Scored::memory)
                .toList();

        queryCache.put(key, new CachedResult(generation, results));
        return results;
    }

    /**
     * Merges duplicates, prunes stale low-importance memories and applies the conflict policy.
     *
     * @return false if the pass could not complete
     */
    public boolean consolidate(String userId) {
        return consolidateWithReport(userId).isPresent();
    }

    /**
     * Runs a consolidation pass under the user's lock.
     *
     * @return the pass report, or empty when storage failed
     */
    public Optional<ConsolidationReport> consolidateWithReport(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return userLocks.withLock(userId, () -> {
            try {
                ConsolidationReport report = runConsolidation(userId);
                log.info("Consolidated memories of user {}: examined={}, duplicates={}, pruned={}, conflicts={}",
                        userId, report.examined(), report.duplicatesRemoved(), report.pruned(),
                        report.conflictsRemoved());
                return Optional.of(report);
            } catch (StorageException e) {
                log.error("Consolidation failed for user {}", userId, e);
                return Optional.empty();
            }
        });
    }

    /**
     * Consolidates every user that owns at least one memory.
     *
     * @return number of users consolidated successfully
     */
    public int consolidateAll() {
        int consolidated = 0;
        for (String userId : knownUserIds()) {
            if (consolidate(userId)) {
                consolidated++;
            }
        }
        return consolidated;
    }

    private ConsolidationReport runConsolidation(String userId) {
        List<Memory> memories = listForUser(userId);
        Set<String> removed = new HashSet<>();

        int duplicates = 0;
        for (List<Memory> group : similarity.findDuplicateGroups(memories)) {
            Memory keep = group.stream()
                    .max(Comparator.comparingDouble(Memory::importance).thenComparing(Memory::createdAt))
                    .orElseThrow();
            for (Memory memory : group) {
                if (!memory.id().equals(keep.id()) && removed.add(memory.id())) {
                    duplicates++;
                }
            }
        }

        Instant pruneBefore = now().minus(PRUNE_AGE);
        int pruned = 0;
        for (Memory memory : memories) {
            if (!removed.contains(memory.id())
                    && memory.importance() < PRUNE_IMPORTANCE_BELOW
                    && memory.createdAt().isBefore(pruneBefore)) {
                removed.add(memory.id());
                pruned++;
            }
        }

        List<Memory> survivors = memories.stream()
                .filter(memory -> !removed.contains(memory.id()))
                .toList();
        int conflicts = 0;
        for (String memoryId : conflictResolver.resolve(userId, survivors)) {
            if (removed.add(memoryId)) {
                conflicts++;
            }
        }

        for (String memoryId : removed) {
            deleteEverywhere(memoryId);
        }
        if (!removed.isEmpty()) {
            invalidate(userId);
        }
        return new ConsolidationReport(userId, memories.size(), duplicates, pruned, conflicts);
    }

    /**
     * Deletes one of the user's memories from durable storage and every backend.
     * A memory owned by another user is treated like a missing one: nothing is deleted
     * and the call succeeds, so callers cannot probe for other users' memory ids.
     *
     * @return false only when the memory id is blank or storage failed
     * @throws IllegalArgumentException if the user id is blank
     */
    public boolean remove(String userId, String memoryId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (memoryId == null || memoryId.isBlank()) {
            return false;
        }

        return userLocks.withLock(userId, () -> {
            try {
                Optional<String> owner = recordStore.get(KEY_PREFIX + memoryId)
                        .map(codec::decodeMemory)
                        .map(Memory::userId);
                if (owner.isPresent() && !owner.get().equals(userId)) {
                    log.debug("Ignored removal of memory {} not owned by user {}", memoryId, userId);
                    return true;
                }
                deleteEverywhere(memoryId);
            } catch (StorageException e) {
                log.error("Failed to remove memory {}", memoryId, e);
                return false;
            }
            invalidate(userId);
            log.debug("Removed memory {}", memoryId);
            return true;
        });
    }

    /**
     * All memories of a user, in key order. Records that cannot be decoded are skipped.
     */
    public List<Memory> listForUser(String userId) {
        List<Memory> memories = new ArrayList<>();
        for (Memory memory : loadAll()) {
            if (memory.userId().equals(userId)) {
                memories.add(memory);
            }
        }
        return memories;
    }

    /**
     * Ids of every user owning at least one memory.
     */
    public Set<String> knownUserIds() {
        Set<String> userIds = new LinkedHashSet<>();
        for (Memory memory : loadAll()) {
            userIds.add(memory.userId());
        }
        return userIds;
    }

    private List<ScoredMemory> gatherCandidates(String userId, String query, int topK) {
        if (backends.isEmpty()) {
            try {
                return listForUser(userId).stream()
                        .map(memory -> new ScoredMemory(memory, MemoryScoring.DEFAULT_RELEVANCE))
                        .toList();
            } catch (StorageException e) {
                log.error("Failed to load memories of user {}", userId, e);
                return List.of();
            }
        }

        Map<String, ScoredMemory> byId = new LinkedHashMap<>();
        for (MemoryRetrievalBackend backend : backends) {
            for (ScoredMemory candidate : searchBackend(backend, userId, query, topK * CANDIDATE_MULTIPLIER)) {
                byId.merge(candidate.memory().id(), candidate,
                        (existing, incoming) -> incoming.relevance() > existing.relevance() ? incoming : existing);
            }
        }
        return new ArrayList<>(byId.values());
    }

    private List<ScoredMemory> searchBackend(MemoryRetrievalBackend backend, String userId, String query, int limit) {
        try {
            List<ScoredMemory> found = CompletableFuture
                    .supplyAsync(() -> backend.search(userId, query, limit), backendExecutor)
                    .get(backendTimeoutSeconds, TimeUnit.SECONDS);
            return found == null ? List.of() : found;
        } catch (TimeoutException e) {
            log.warn("Backend {} timed out after {}s", backend.name(), backendTimeoutSeconds);
        } catch (ExecutionException e) {
            log.warn("Backend {} search failed: {}", backend.name(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while searching backend {}", backend.name());
        } catch (RuntimeException e) {
            log.warn("Backend {} search could not run: {}", backend.name(), e.getMessage());
        }
        return List.of();
    }

    private void deleteEverywhere(String memoryId) {
        recordStore.delete(KEY_PREFIX + memoryId);
        for (MemoryRetrievalBackend backend : backends) {
            try {
                backend.remove(memoryId);
            } catch (RuntimeException e) {
                log.warn("Backend {} failed to remove memory {}: {}", backend.name(), memoryId, e.getMessage());
            }
        }
    }

    private List<Memory> loadAll() {
        List<Memory> memories = new ArrayList<>();
        for (String key : recordStore.scan(KEY_PREFIX)) {
            try {
                recordStore.get(key).map(codec::decodeMemory).ifPresent(memories::add);
            } catch (StorageException e) {
                log.warn("Skipping unreadable memory record {}: {}", key, e.getMessage());
            }
        }
        return memories;
    }

    private long generation(String userId) {
        return generations.computeIfAbsent(userId, k -> new AtomicLong()).get();
    }

    private void invalidate(String userId) {
        generations.computeIfAbsent(userId, k -> new AtomicLong()).incrementAndGet();
        queryCache.keySet().removeIf(key -> key.userId().equals(userId));
    }

    private Instant now() {
        return Timestamps.truncate(clock.instant());
    }

    private record QueryKey(String userId, String query, int topK, Set<MemoryType> types,
                            double minImportance, Integer maxAgeDays) {
    }

    private record CachedResult(long generation, List<Memory> memories) {
    }

    private record Scored(Memory memory, double score) {
    }
}
