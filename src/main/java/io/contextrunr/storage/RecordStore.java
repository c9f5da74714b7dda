package io.contextrunr.storage;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value persistence for session and memory records.
 * Implementations throw {@link StorageException} on I/O failures.
 */
public interface RecordStore {

    /**
     * @return the stored document, or empty when the key is unknown
     */
    Optional<String> get(String key);

    /**
     * Creates or replaces the document stored under a key.
     */
    void set(String key, String value);

    /**
     * Deletes a key.
     *
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * Lists keys starting with a prefix, in ascending order.
     */
    List<String> scan(String prefix);

    /**
     * Health check: verifies the store is operational.
     */
    boolean healthCheck();
}
