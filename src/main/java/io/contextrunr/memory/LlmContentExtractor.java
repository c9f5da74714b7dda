package io.contextrunr.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;
import java.util.Optional;

/**
 * LLM-driven extractor: asks the chat model to pull out the facts or procedures that relate
 * to the configured topics. The model answers {@code NONE} when nothing is worth keeping.
 */
public class LlmContentExtractor implements ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmContentExtractor.class);
    static final String NOTHING_FOUND = "NONE";

    private static final String SYSTEM_PROMPT = """
            You extract long-term memories from conversations between a user and an assistant.
            Only keep information about these topics:
            %s
            Reply with the relevant facts or procedures as short, self-contained sentences.
            Do not add commentary. If nothing in the conversation relates to the topics, reply with exactly NONE.
            """;

    private final ChatClient chatClient;

    public LlmContentExtractor(ChatModel chatModel) {
        this(ChatClient.create(chatModel));
    }

    LlmContentExtractor(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Optional<String> extract(String conversationText, List<String> topicDefinitions) {
        if (conversationText == null || conversationText.isBlank()
                || topicDefinitions == null || topicDefinitions.isEmpty()) {
            return Optional.empty();
        }

        String topics = String.join("\n", topicDefinitions.stream().map(t -> "- " + t).toList());
        String answer = chatClient.prompt()
                .system(SYSTEM_PROMPT.formatted(topics))
                .user(conversationText)
                .call()
                .content();

        if (answer == null || answer.isBlank() || answer.trim().equalsIgnoreCase(NOTHING_FOUND)) {
            log.debug("LLM extractor found nothing to remember");
            return Optional.empty();
        }
        return Optional.of(answer.trim());
    }
}
