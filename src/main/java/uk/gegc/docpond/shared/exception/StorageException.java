package uk.gegc.docpond.shared.exception;

/**
 * Raised when an object cannot be read from or written to the configured storage backend.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
