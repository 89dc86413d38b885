package io.sultan.repository;

/**
 * Insert rejected by the engine's unique constraint on username or email.
 */
public class DuplicateUserException extends RuntimeException {

    public enum Field {
        USERNAME,
        EMAIL
    }

    private final Field field;

    public DuplicateUserException(Field field, Throwable cause) {
        super("Duplicate " + field.name().toLowerCase(), cause);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}
