package io.contextrunr.memory;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TopicKeywordExtractorTest {

    private final TopicKeywordExtractor extractor = new TopicKeywordExtractor();

    @Test
    void shouldReturnWholeTextWhenTopicPhraseOccurs() {
        String text = "My personal preferences: window seats and vegetarian meals.";

        assertEquals(Optional.of(text), extractor.extract(text, List.of("personal preferences")));
    }

    @Test
    void shouldMatchCaseInsensitively() {
        assertTrue(extractor.extract("USER GOALS for this year", List.of("user goals")).isPresent());
    }

    @Test
    void shouldMatchSingularFormOfTopicWords() {
        String text = "this is an important decision about the move";

        assertTrue(extractor.extract(text, List.of("important decisions")).isPresent());
    }

    @Test
    void shouldReturnEmptyWithoutTopicMatch() {
        assertTrue(extractor.extract("The weather is nice today", List.of("contact information")).isEmpty());
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertTrue(extractor.extract("  ", List.of("user goals")).isEmpty());
        assertTrue(extractor.extract(null, List.of("user goals")).isEmpty());
        assertTrue(extractor.extract("user goals", null).isEmpty());
    }
}
