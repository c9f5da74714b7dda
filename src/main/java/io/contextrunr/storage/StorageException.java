package io.contextrunr.storage;

/**
 * A durable store could not read or write a record. Services catch it at their boundary
 * and report the operation as failed.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
