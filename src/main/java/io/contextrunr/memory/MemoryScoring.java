package io.contextrunr.memory;

import java.time.Duration;
import java.util.List;

/**
 * Heuristics for classifying, weighting and ranking memories.
 *
 * <p>Blended score: {@code 0.4 * importance + 0.4 * relevance + 0.2 * recency}, where
 * recency is {@code 1 / (1 + ageHours / 24)}.</p>
 */
public final class MemoryScoring {

    public static final double BASE_IMPORTANCE = 0.5;
    public static final double KEYWORD_BOOST = 0.2;
    public static final int LENGTH_NORMALIZATION_CHARS = 500;
    public static final double DEFAULT_RELEVANCE = 0.5;

    static final double IMPORTANCE_WEIGHT = 0.4;
    static final double RELEVANCE_WEIGHT = 0.4;
    static final double RECENCY_WEIGHT = 0.2;

    private static final List<String> PROCEDURAL_INDICATORS = List.of(
            "how to", "steps to", "process", "procedure", "method",
            "algorithm", "way to", "technique"
    );

    private static final List<String> IMPORTANCE_KEYWORDS = List.of(
            "important", "critical", "essential", "key", "must",
            "name", "birthday", "preference", "allergy", "requirement"
    );

    private MemoryScoring() {
    }

    /**
     * Procedural when the content mentions any process-indicating phrase, declarative otherwise.
     */
    public static MemoryType classify(String content) {
        String lower = content == null ? "" : content.toLowerCase();
        for (String indicator : PROCEDURAL_INDICATORS) {
            if (lower.contains(indicator)) {
                return MemoryType.PROCEDURAL;
            }
        }
        return MemoryType.DECLARATIVE;
    }

    /**
     * Base 0.5, +0.2 for every importance keyword present (capped at 1.0), then averaged
     * with a length factor {@code min(1, length / 500)}.
     *
     * @return importance within [0, 1]
     */
    public static double assessImportance(String content) {
        String text = content == null ? "" : content;
        double importance = BASE_IMPORTANCE;
        String lower = text.toLowerCase();
        for (String keyword : IMPORTANCE_KEYWORDS) {
            if (lower.contains(keyword)) {
                importance = Math.min(1.0, importance + KEYWORD_BOOST);
            }
        }

        double lengthFactor = Math.min(1.0, (double) text.length() / LENGTH_NORMALIZATION_CHARS);
        return clamp((importance + lengthFactor) / 2);
    }

    /**
     * Recency with a 24-hour half-life: 1.0 at age zero, 0.5 at 24 hours, tending to 0.
     * Negative ages (clock skew) count as zero.
     */
    public static double recency(Duration age) {
        double ageHours = Math.max(0L, age.toMillis()) / 3_600_000.0;
        return clamp(1.0 / (1.0 + ageHours / 24.0));
    }

    public static double blendedScore(double importance, double relevance, double recency) {
        return IMPORTANCE_WEIGHT * importance + RELEVANCE_WEIGHT * relevance + RECENCY_WEIGHT * recency;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
