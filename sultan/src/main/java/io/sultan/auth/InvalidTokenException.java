package io.sultan.auth;

/**
 * Token rejected by the issuer. The reason stays inside the auth layer; callers across the
 * service boundary only ever see invalid credentials.
 */
public class InvalidTokenException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED,
        UNKNOWN,
        CONSUMED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isExpired() {
        return reason == Reason.EXPIRED;
    }
}
