package io.contextrunr.config;

import io.contextrunr.memory.SQLiteKeywordIndex;
import io.contextrunr.storage.FileRecordStore;
import io.contextrunr.storage.RecordCodec;
import io.contextrunr.storage.RecordStore;
import io.contextrunr.storage.SQLiteRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Durable storage wiring: the record store selected by {@code context.storage.type},
 * the optional SQLite keyword index, and the clock every service reads time from.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public RecordStore recordStore(ContextProperties properties) {
        ContextProperties.Storage storage = properties.storage();
        if (storage.isFile()) {
            log.info("Using file record store at {}", storage.path());
            return new FileRecordStore(Path.of(storage.path()));
        }

        SQLiteRecordStore store = new SQLiteRecordStore(storage.path());
        store.init();
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "context.memory", name = "keyword-index-enabled",
            havingValue = "true", matchIfMissing = true)
    public SQLiteKeywordIndex keywordIndex(ContextProperties properties, RecordCodec codec) {
        SQLiteKeywordIndex index = new SQLiteKeywordIndex(properties.memory().keywordIndexPath(), codec);
        index.init();
        return index;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
