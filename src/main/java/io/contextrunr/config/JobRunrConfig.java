package io.contextrunr.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JobRunr configuration. Provides a SQLite DataSource for persistent job storage.
 * The jobrunr-spring-boot-3-starter auto-configures the StorageProvider from this DataSource.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource dataSource(
            @Value("${context.jobs.database-url:jdbc:sqlite:./data/jobrunr.db}") String url
    ) {
        createParentDirectories(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("JobRunr SQLite DataSource configured: {}", url);
        return ds;
    }

    private static void createParentDirectories(String url) {
        if (!url.startsWith(SQLITE_PREFIX) || url.contains(":memory:")) {
            return;
        }
        Path parent = Path.of(url.substring(SQLITE_PREFIX.length())).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create JobRunr database directory " + parent, e);
        }
    }
}
