package io.sultan.auth;

/**
 * Thrown when a password cannot be hashed, or when a stored hash is structurally corrupt.
 * A wrong password is never reported through this exception.
 */
public class HashingException extends RuntimeException {

    public HashingException(String message) {
        super(message);
    }

    public HashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
