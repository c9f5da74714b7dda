package io.contextrunr.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Treats memories as duplicates when their content is equal after lower-casing,
 * collapsing whitespace and stripping trailing punctuation.
 */
public class NormalizedContentSimilarity implements SimilarityStrategy {

    @Override
    public List<List<Memory>> findDuplicateGroups(List<Memory> memories) {
        Map<String, List<Memory>> byContent = new LinkedHashMap<>();
        for (Memory memory : memories) {
            byContent.computeIfAbsent(normalize(memory.content()), k -> new ArrayList<>()).add(memory);
        }
        return byContent.values().stream()
                .filter(group -> group.size() > 1)
                .toList();
    }

    static String normalize(String content) {
        return content.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim()
                .replaceAll("[.!?,;:]+$", "");
    }
}
