package io.contextrunr.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        var props = ContextProperties.defaults();

        assertEquals(3000, props.session().maxTokenLimit());
        assertEquals(7, props.session().ttlDays());
        assertTrue(props.session().piiRedactionEnabled());
        assertEquals("0 * * * *", props.session().sweepCron());
        assertEquals(0.3, props.memory().importanceThreshold());
        assertEquals(5, props.memory().maxMemoriesPerQuery());
        assertEquals(24, props.memory().consolidationIntervalHours());
        assertEquals(10, props.memory().backendTimeoutSeconds());
        assertEquals(ContextProperties.Memory.DEFAULT_TOPICS, props.memory().topics());
        assertFalse(props.memory().useLlmExtractor());
        assertEquals("sqlite", props.storage().type());
        assertEquals("./data/context.db", props.storage().path());
        assertEquals(4, props.background().workerThreads());
        assertTrue(props.background().maintenanceEnabled());
    }

    @Test
    void shouldDefaultFileStoragePath() {
        var storage = new ContextProperties.Storage("file", null);

        assertTrue(storage.isFile());
        assertEquals("./data/records", storage.path());
    }

    @Test
    void shouldRejectNonPositiveTokenLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ContextProperties.Session(0, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new ContextProperties.Session(null, -1, null, null));
    }

    @Test
    void shouldRecognizeLlmExtractor() {
        var memory = new ContextProperties.Memory(null, null, null, null, "LLM", null, null, null);

        assertTrue(memory.useLlmExtractor());
    }

    @Test
    void shouldBindKebabCaseProperties() {
        var source = new MapConfigurationPropertySource(Map.of(
                "context.session.max-token-limit", "40",
                "context.session.pii-redaction-enabled", "false",
                "context.memory.topics[0]", "travel plans",
                "context.memory.extractor", "llm",
                "context.storage.type", "file",
                "context.background.queue-capacity", "10"
        ));

        ContextProperties props = new Binder(source).bind("context", ContextProperties.class).get();

        assertEquals(40, props.session().maxTokenLimit());
        assertFalse(props.session().piiRedactionEnabled());
        assertEquals(7, props.session().ttlDays());
        assertEquals(List.of("travel plans"), props.memory().topics());
        assertTrue(props.memory().useLlmExtractor());
        assertTrue(props.storage().isFile());
        assertEquals(10, props.background().queueCapacity());
    }
}
