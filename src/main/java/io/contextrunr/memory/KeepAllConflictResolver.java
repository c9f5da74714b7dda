package io.contextrunr.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default conflict policy: detects nothing and keeps every memory.
 */
public class KeepAllConflictResolver implements ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(KeepAllConflictResolver.class);

    @Override
    public List<String> resolve(String userId, List<Memory> memories) {
        log.debug("No conflict policy configured, keeping all {} memories of user {}", memories.size(), userId);
        return List.of();
    }
}
