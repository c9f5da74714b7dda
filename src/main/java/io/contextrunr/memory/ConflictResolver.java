package io.contextrunr.memory;

import java.util.List;

/**
 * Extension point for contradictory memories found during consolidation.
 * Whether conflicts should be merged, flagged, or resolved in favour of the newer memory
 * is application policy; implementations decide.
 */
@FunctionalInterface
public interface ConflictResolver {

    /**
     * @param userId   the user being consolidated
     * @param memories the user's memories left after deduplication
     * @return ids of memories to remove
     */
    List<String> resolve(String userId, List<Memory> memories);
}
