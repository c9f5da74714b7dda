package io.contextrunr.config;

import io.contextrunr.memory.ConflictResolver;
import io.contextrunr.memory.ContentExtractor;
import io.contextrunr.memory.KeepAllConflictResolver;
import io.contextrunr.memory.LlmContentExtractor;
import io.contextrunr.memory.NormalizedContentSimilarity;
import io.contextrunr.memory.SimilarityStrategy;
import io.contextrunr.memory.TopicKeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pluggable memory policies. Each bean backs off when the application defines its own.
 */
@Configuration
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ContentExtractor contentExtractor(ContextProperties properties, ObjectProvider<ChatModel> chatModel) {
        if (properties.memory().useLlmExtractor()) {
            ChatModel model = chatModel.getIfAvailable();
            if (model != null) {
                log.info("Memory extraction: LLM ({})", model.getClass().getSimpleName());
                return new LlmContentExtractor(model);
            }
            log.warn("context.memory.extractor=llm but no ChatModel is configured, using topic keywords");
        }
        log.info("Memory extraction: topic keywords");
        return new TopicKeywordExtractor();
    }

    @Bean
    @ConditionalOnMissingBean
    public SimilarityStrategy similarityStrategy() {
        return new NormalizedContentSimilarity();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictResolver conflictResolver() {
        return new KeepAllConflictResolver();
    }
}
