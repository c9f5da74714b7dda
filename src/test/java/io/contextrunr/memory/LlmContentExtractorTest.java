package io.contextrunr.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LlmContentExtractorTest {

    private ChatClient chatClient;
    private LlmContentExtractor extractor;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        extractor = new LlmContentExtractor(chatClient);
    }

    @Test
    void shouldReturnModelAnswer() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenReturn("  User prefers aisle seats.  ");

        Optional<String> result = extractor.extract("I always book aisle seats", List.of("personal preferences"));

        assertEquals(Optional.of("User prefers aisle seats."), result);
    }

    @Test
    void shouldReturnEmptyWhenModelFindsNothing() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn("none");

        assertTrue(extractor.extract("Nice weather", List.of("user goals")).isEmpty());
    }

    @Test
    void shouldNotCallModelWithoutTopics() {
        ChatClient unused = mock(ChatClient.class);

        assertTrue(new LlmContentExtractor(unused).extract("text", List.of()).isEmpty());
        verifyNoInteractions(unused);
    }
}
