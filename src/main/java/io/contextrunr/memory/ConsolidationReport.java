package io.contextrunr.memory;

/**
 * Outcome of one consolidation pass over a user's memories.
 *
 * @param userId            the consolidated user
 * @param examined          memories loaded at the start of the pass
 * @param duplicatesRemoved memories merged away as duplicates
 * @param pruned            low-importance memories removed for age
 * @param conflictsRemoved  memories removed by the conflict policy
 */
public record ConsolidationReport(String userId, int examined, int duplicatesRemoved, int pruned, int conflictsRemoved) {

    public int removed() {
        return duplicatesRemoved + pruned + conflictsRemoved;
    }

    public int remaining() {
        return examined - removed();
    }
}
