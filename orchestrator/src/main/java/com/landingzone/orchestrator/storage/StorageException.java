package com.landingzone.orchestrator.storage;

/**
 * Thrown when the object store returns an error or is unreachable.
 */
public class StorageException extends RuntimeException {

    private final int statusCode;

    public StorageException(String message) {
        this(message, -1);
    }

    public StorageException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the backend, or -1 for transport failures. */
    public int statusCode() { return statusCode; }
}
