package io.contextrunr.memory;

/**
 * A retrieval candidate returned by a {@link MemoryRetrievalBackend}.
 *
 * @param memory    the candidate memory
 * @param relevance backend relevance score in [0.0, 1.0]
 */
public record ScoredMemory(Memory memory, double relevance) {

    public ScoredMemory {
        relevance = MemoryScoring.clamp(relevance);
    }
}
