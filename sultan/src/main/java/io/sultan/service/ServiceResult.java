package io.sultan.service;

import java.util.Objects;

/**
 * Outcome of a UserService call: a value, or an error kind with a caller-safe message.
 */
public record ServiceResult<T>(
    boolean success,
    T value,
    ErrorKind error,
    String message
) {
    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(true, value, null, null);
    }

    public static <T> ServiceResult<T> failure(ErrorKind error, String message) {
        Objects.requireNonNull(error, "error");
        return new ServiceResult<>(false, null, error, message);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T orElseThrow() {
        if (!success) {
            throw new IllegalStateException("No value: " + error + " (" + message + ")");
        }
        return value;
    }
}
