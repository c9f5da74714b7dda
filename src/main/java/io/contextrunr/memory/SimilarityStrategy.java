package io.contextrunr.memory;

import java.util.List;

/**
 * Groups near-identical memories for consolidation.
 */
@FunctionalInterface
public interface SimilarityStrategy {

    /**
     * @param memories all memories of one user
     * @return groups of duplicates; only groups with two or more members are returned
     */
    List<List<Memory>> findDuplicateGroups(List<Memory> memories);
}
