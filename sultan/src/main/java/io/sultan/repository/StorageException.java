package io.sultan.repository;

/**
 * Storage fault: lost connection, query error, or a constraint violation that is not a
 * username/email duplicate. The message is for logs only.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
