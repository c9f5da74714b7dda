package io.contextrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for the context engine.
 *
 * <p>Binds to {@code context.*} in application.yml:</p>
 * <pre>
 * context:
 *   session:
 *     max-token-limit: 3000
 *     ttl-days: 7
 *     pii-redaction-enabled: true
 *     sweep-cron: "0 * * * *"
 *   memory:
 *     importance-threshold: 0.3
 *     max-memories-per-query: 5
 *     consolidation-interval-hours: 24
 *     backend-timeout-seconds: 10
 *     extractor: keyword
 *     keyword-index-enabled: true
 *     keyword-index-path: ./data/memory-index.db
 *     topics:
 *       - personal preferences
 *       - important decisions
 *   storage:
 *     type: sqlite
 *     path: ./data/context.db
 *   background:
 *     worker-threads: 4
 *     queue-capacity: 100
 *     maintenance-enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "context")
public record ContextProperties(Session session, Memory memory, Storage storage, Background background) {

    public ContextProperties {
        if (session == null) {
            session = new Session(null, null, null, null);
        }
        if (memory == null) {
            memory = new Memory(null, null, null, null, null, null, null, null);
        }
        if (storage == null) {
            storage = new Storage(null, null);
        }
        if (background == null) {
            background = new Background(null, null, null);
        }
    }

    /** Defaults for every property group. */
    public static ContextProperties defaults() {
        return new ContextProperties(null, null, null, null);
    }

    /**
     * Short-term session settings.
     *
     * @param maxTokenLimit       token budget for a session's history (estimated as characters / 4)
     * @param ttlDays             days of inactivity after which the sweep archives a session
     * @param piiRedactionEnabled whether message content is redacted before persistence
     * @param sweepCron           cron expression for the recurring TTL sweep
     */
    public record Session(Integer maxTokenLimit, Integer ttlDays, Boolean piiRedactionEnabled, String sweepCron) {
        public Session {
            if (maxTokenLimit == null) maxTokenLimit = 3000;
            if (ttlDays == null) ttlDays = 7;
            if (piiRedactionEnabled == null) piiRedactionEnabled = true;
            if (sweepCron == null || sweepCron.isBlank()) sweepCron = "0 * * * *";
            if (maxTokenLimit <= 0) {
                throw new IllegalArgumentException("context.session.max-token-limit must be positive");
            }
            if (ttlDays <= 0) {
                throw new IllegalArgumentException("context.session.ttl-days must be positive");
            }
        }
    }

    /**
     * Long-term memory settings.
     *
     * @param importanceThreshold        minimum importance for prompt-enrichment retrieval
     * @param maxMemoriesPerQuery        default top-k for prompt-enrichment retrieval
     * @param consolidationIntervalHours interval of the recurring consolidation job
     * @param backendTimeoutSeconds      timeout applied to every retrieval backend call
     * @param extractor                  content extractor: "keyword" (default) or "llm"
     * @param keywordIndexEnabled        whether the SQLite FTS5 retrieval backend is registered
     * @param keywordIndexPath           database file of the keyword index
     * @param topics                     topic definitions used for memory generation after each turn
     */
    public record Memory(
            Double importanceThreshold,
            Integer maxMemoriesPerQuery,
            Integer consolidationIntervalHours,
            Integer backendTimeoutSeconds,
            String extractor,
            Boolean keywordIndexEnabled,
            String keywordIndexPath,
            List<String> topics
    ) {
        public static final List<String> DEFAULT_TOPICS = List.of(
                "personal preferences",
                "important facts",
                "user goals",
                "contact information",
                "important decisions"
        );

        public Memory {
            if (importanceThreshold == null) importanceThreshold = 0.3;
            if (maxMemoriesPerQuery == null) maxMemoriesPerQuery = 5;
            if (consolidationIntervalHours == null) consolidationIntervalHours = 24;
            if (backendTimeoutSeconds == null) backendTimeoutSeconds = 10;
            if (extractor == null || extractor.isBlank()) extractor = "keyword";
            if (keywordIndexEnabled == null) keywordIndexEnabled = true;
            if (keywordIndexPath == null || keywordIndexPath.isBlank()) keywordIndexPath = "./data/memory-index.db";
            if (topics == null || topics.isEmpty()) topics = DEFAULT_TOPICS;
        }

        public boolean useLlmExtractor() {
            return "llm".equalsIgnoreCase(extractor);
        }
    }

    /**
     * Durable record storage.
     *
     * @param type "sqlite" (default) or "file"
     * @param path database file for sqlite, base directory for file
     */
    public record Storage(String type, String path) {
        public Storage {
            if (type == null || type.isBlank()) type = "sqlite";
            if (path == null || path.isBlank()) {
                path = "file".equalsIgnoreCase(type) ? "./data/records" : "./data/context.db";
            }
        }

        public boolean isFile() {
            return "file".equalsIgnoreCase(type);
        }
    }

    /**
     * Background work settings.
     *
     * @param workerThreads      threads of the in-process pool for detached tasks
     * @param queueCapacity      bound of the in-process task queue
     * @param maintenanceEnabled whether the sweep and consolidation recurring jobs are registered
     */
    public record Background(Integer workerThreads, Integer queueCapacity, Boolean maintenanceEnabled) {
        public Background {
            if (workerThreads == null || workerThreads <= 0) workerThreads = 4;
            if (queueCapacity == null || queueCapacity < 0) queueCapacity = 100;
            if (maintenanceEnabled == null) maintenanceEnabled = true;
        }
    }
}
