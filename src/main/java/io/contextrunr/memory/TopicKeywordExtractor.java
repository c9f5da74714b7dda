package io.contextrunr.memory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keyword-based extractor used when no LLM extractor is configured.
 *
 * <p>A topic matches when the transcript contains the topic phrase, or contains every word of
 * the topic with a trailing plural "s" dropped ("important decisions" matches
 * "an important decision"). On a match the whole transcript is remembered.</p>
 */
public class TopicKeywordExtractor implements ContentExtractor {

    @Override
    public Optional<String> extract(String conversationText, List<String> topicDefinitions) {
        if (conversationText == null || conversationText.isBlank() || topicDefinitions == null) {
            return Optional.empty();
        }

        String lower = conversationText.toLowerCase(Locale.ROOT);
        for (String topic : topicDefinitions) {
            if (topic != null && !topic.isBlank() && matches(lower, topic.toLowerCase(Locale.ROOT).trim())) {
                return Optional.of(conversationText);
            }
        }
        return Optional.empty();
    }

    private boolean matches(String text, String topic) {
        if (text.contains(topic)) {
            return true;
        }
        for (String word : topic.split("\\s+")) {
            if (!text.contains(singular(word))) {
                return false;
            }
        }
        return true;
    }

    private String singular(String word) {
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
