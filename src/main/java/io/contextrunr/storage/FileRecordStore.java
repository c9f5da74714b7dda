package io.contextrunr.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-based record store: one JSON document per key.
 *
 * <p>Directory structure:</p>
 * <pre>
 * {context.storage.path}/
 *   session%3Asession_1b2c....json
 *   memory%3Amem_1740736500000_alice_9f8e7d6c.json
 * </pre>
 *
 * <p>Keys are URL-encoded into file names. Writes go to a temporary file first and are
 * moved into place, so readers never see a half-written document.</p>
 */
public class FileRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(FileRecordStore.class);
    private static final String SUFFIX = ".json";

    private final Path basePath;

    public FileRecordStore(Path basePath) {
        this.basePath = basePath;
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new StorageException("Failed to create record directory: " + basePath, e);
        }
        log.info("FileRecordStore initialized at: {}", basePath.toAbsolutePath());
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readString(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read record: " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = fileFor(key);
        Path temp = basePath.resolve(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, value);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored record: {}", key);
        } catch (IOException e) {
            throw new StorageException("Failed to write record: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete record: " + key, e);
        }
    }

    @Override
    public List<String> scan(String prefix) {
        try (Stream<Path> paths = Files.list(basePath)) {
            return paths.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8))
                    .filter(key -> key.startsWith(prefix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list records with prefix: " + prefix, e);
        }
    }

    @Override
    public boolean healthCheck() {
        return Files.isDirectory(basePath) && Files.isWritable(basePath);
    }

    private Path fileFor(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Record key is required");
        }
        return basePath.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
