package io.sultan.service;

/**
 * Failure kinds visible across the service boundary.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    DUPLICATE_USERNAME,
    DUPLICATE_EMAIL,
    INVALID_CREDENTIALS,
    NOT_FOUND,
    /** Storage or hashing fault. Details are logged, never returned. */
    INTERNAL
}
