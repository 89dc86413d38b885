package io.sultan.security;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registration input policy.
 *
 * Validation Rules:
 * - Username: 3-50 characters, letters, digits, '_', '.', '-'
 * - Email: at most 255 characters, one '@', dotted domain, no whitespace
 * - Password: 8-128 characters, not blank
 *
 * Each check returns the violated rule, or empty when the value is acceptable. Messages name the
 * rule only, never the submitted value.
 */
public class InputValidator {

    public static final int USERNAME_MIN_LENGTH = 3;
    public static final int USERNAME_MAX_LENGTH = 50;
    public static final int EMAIL_MAX_LENGTH = 255;
    public static final int PASSWORD_MIN_LENGTH = 8;
    public static final int PASSWORD_MAX_LENGTH = 128;

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public Optional<String> checkUsername(String username) {
        if (username == null || username.isEmpty()) {
            return Optional.of("Username is required");
        }
        if (username.length() < USERNAME_MIN_LENGTH || username.length() > USERNAME_MAX_LENGTH) {
            return Optional.of("Username must be between " + USERNAME_MIN_LENGTH + " and "
                + USERNAME_MAX_LENGTH + " characters");
        }
        if (!USERNAME_PATTERN.matcher(username).matches()) {
            return Optional.of("Username may only contain letters, digits, '_', '.' and '-'");
        }
        return Optional.empty();
    }

    public Optional<String> checkEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.of("Email is required");
        }
        String normalized = normalizeEmail(email);
        if (normalized.length() > EMAIL_MAX_LENGTH) {
            return Optional.of("Email must be at most " + EMAIL_MAX_LENGTH + " characters");
        }
        if (!EMAIL_PATTERN.matcher(normalized).matches()) {
            return Optional.of("Invalid email format");
        }
        return Optional.empty();
    }

    public Optional<String> checkPassword(String password) {
        if (password == null || password.isBlank()) {
            return Optional.of("Password is required");
        }
        if (password.length() < PASSWORD_MIN_LENGTH) {
            return Optional.of("Password must be at least " + PASSWORD_MIN_LENGTH + " characters");
        }
        if (password.length() > PASSWORD_MAX_LENGTH) {
            return Optional.of("Password must be at most " + PASSWORD_MAX_LENGTH + " characters");
        }
        return Optional.empty();
    }

    /**
     * Emails are stored trimmed and lower-cased so uniqueness is case-insensitive.
     */
    public String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
