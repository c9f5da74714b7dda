package io.contextrunr.memory;

import java.util.List;
import java.util.Optional;

/**
 * Extracts the span of a conversation worth remembering for the given topics.
 */
@FunctionalInterface
public interface ContentExtractor {

    /**
     * @param conversationText the transcript to scan
     * @param topicDefinitions topics that make content worth remembering
     * @return the content to remember, or empty when nothing relevant was found
     */
    Optional<String> extract(String conversationText, List<String> topicDefinitions);
}
