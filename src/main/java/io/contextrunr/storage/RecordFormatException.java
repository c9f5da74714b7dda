package io.contextrunr.storage;

/**
 * A persisted record could not be decoded: malformed JSON, an unexpected kind,
 * or a schema version newer than this build understands.
 */
public class RecordFormatException extends StorageException {

    public RecordFormatException(String message) {
        super(message);
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
