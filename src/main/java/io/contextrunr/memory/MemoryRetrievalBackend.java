package io.contextrunr.memory;

import java.util.List;

/**
 * A semantic retrieval capability (vector index, knowledge graph, keyword index).
 * The memory store writes every memory to each configured backend and gathers
 * candidates from all of them at retrieval time.
 */
public interface MemoryRetrievalBackend {

    /** Short name used in logs. */
    String name();

    /**
     * Indexes a memory. Indexing the same id again replaces the previous entry.
     */
    void index(Memory memory);

    /**
     * Removes a memory from the index. Removing an unknown id is not an error.
     */
    void remove(String memoryId);

    /**
     * Searches a user's memories.
     *
     * @param userId the owner whose memories are searched
     * @param query  the search query
     * @param topK   maximum number of candidates
     * @return candidates with relevance in [0, 1], best first
     */
    List<ScoredMemory> search(String userId, String query, int topK);
}
