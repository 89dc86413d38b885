package io.sultan.service;

import io.sultan.auth.HashingException;
import io.sultan.auth.InvalidTokenException;
import io.sultan.auth.PasswordHasher;
import io.sultan.auth.TokenIssuer;
import io.sultan.auth.TokenPair;
import io.sultan.domain.user.User;
import io.sultan.metrics.AuthMetrics;
import io.sultan.metrics.AuthMetrics.Operation;
import io.sultan.repository.DuplicateUserException;
import io.sultan.repository.StorageException;
import io.sultan.repository.UserRepository;
import io.sultan.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * User registration, login and session refresh.
 *
 * Every public method returns a {@link ServiceResult}; storage and hashing faults are logged here
 * and reported as {@link ErrorKind#INTERNAL} with a generic message. Plaintext passwords are
 * never stored or logged.
 */
public final class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private static final String MSG_INVALID_CREDENTIALS = "Invalid credentials";
    private static final String MSG_INTERNAL = "Request could not be completed";
    private static final String MSG_USERNAME_TAKEN = "Username already registered";
    private static final String MSG_EMAIL_TAKEN = "Email already registered";
    private static final String MSG_NOT_FOUND = "User not found";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenIssuer tokenIssuer;
    private final InputValidator validator;
    private final AuthMetrics metrics;

    // Verified against when the username is unknown, so both login failures cost one Argon2 run
    private final String placeholderHash;

    public UserService(UserRepository userRepository, PasswordHasher passwordHasher, TokenIssuer tokenIssuer,
                       InputValidator validator, AuthMetrics metrics) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.tokenIssuer = tokenIssuer;
        this.validator = validator;
        this.metrics = metrics;
        this.placeholderHash = passwordHasher.hash(randomSecret());
    }

    /**
     * Register a new user.
     */
    public ServiceResult<User> register(String username, String email, String password) {
        long start = System.nanoTime();
        ServiceResult<User> result = doRegister(username, email, password);
        metrics.record(Operation.REGISTER, outcome(result), start);
        return result;
    }

    private ServiceResult<User> doRegister(String username, String email, String password) {
        Optional<String> violation = validator.checkUsername(username)
            .or(() -> validator.checkEmail(email))
            .or(() -> validator.checkPassword(password));
        if (violation.isPresent()) {
            return ServiceResult.failure(ErrorKind.VALIDATION_ERROR, violation.get());
        }

        String normalizedEmail = validator.normalizeEmail(email);

        try {
            String passwordHash = passwordHasher.hash(password);
            User user = userRepository.create(username, normalizedEmail, passwordHash);
            log.info("[REGISTER] User registered: {} ({})", user.username(), user.id());
            return ServiceResult.success(user);

        } catch (DuplicateUserException e) {
            log.info("[REGISTER] Rejected duplicate {} for {}", e.getField().name().toLowerCase(), username);
            return e.getField() == DuplicateUserException.Field.USERNAME
                ? ServiceResult.failure(ErrorKind.DUPLICATE_USERNAME, MSG_USERNAME_TAKEN)
                : ServiceResult.failure(ErrorKind.DUPLICATE_EMAIL, MSG_EMAIL_TAKEN);
        } catch (HashingException e) {
            log.error("[REGISTER] Password hashing failed for {}: {}", username, e.getMessage(), e);
            return internal();
        } catch (StorageException e) {
            log.error("[REGISTER] Storage failure for {}: {}", username, e.getMessage(), e);
            return internal();
        }
    }

    /**
     * Check credentials and issue a token pair.
     * Unknown username and wrong password are indistinguishable, including in timing.
     */
    public ServiceResult<TokenPair> login(String username, String password) {
        long start = System.nanoTime();
        ServiceResult<TokenPair> result = doLogin(username, password);
        metrics.record(Operation.LOGIN, outcome(result), start);
        return result;
    }

    private ServiceResult<TokenPair> doLogin(String username, String password) {
        String candidate = password != null ? password : "";

        try {
            Optional<User> found = (username == null || username.isEmpty())
                ? Optional.empty()
                : userRepository.findByUsername(username);

            if (found.isEmpty()) {
                passwordHasher.verify(candidate, placeholderHash);
                log.debug("[LOGIN] Unknown username");
                return ServiceResult.failure(ErrorKind.INVALID_CREDENTIALS, MSG_INVALID_CREDENTIALS);
            }

            User user = found.get();
            if (!passwordHasher.verify(candidate, user.passwordHash())) {
                log.debug("[LOGIN] Wrong password for user {}", user.id());
                return ServiceResult.failure(ErrorKind.INVALID_CREDENTIALS, MSG_INVALID_CREDENTIALS);
            }

            TokenPair tokens = tokenIssuer.issuePair(user.id());
            log.info("[LOGIN] User logged in: {} ({})", user.username(), user.id());
            return ServiceResult.success(tokens);

        } catch (HashingException e) {
            log.error("[LOGIN] Stored password hash unusable for {}: {}", username, e.getMessage(), e);
            return internal();
        } catch (StorageException e) {
            log.error("[LOGIN] Storage failure for {}: {}", username, e.getMessage(), e);
            return internal();
        }
    }

    /**
     * Exchange a refresh token for a new pair. Every token problem reads as invalid credentials.
     */
    public ServiceResult<TokenPair> refresh(String refreshToken) {
        long start = System.nanoTime();
        ServiceResult<TokenPair> result;
        try {
            result = ServiceResult.success(tokenIssuer.rotate(refreshToken));
        } catch (InvalidTokenException e) {
            log.debug("[REFRESH] Rejected refresh token: {}", e.getReason());
            result = ServiceResult.failure(ErrorKind.INVALID_CREDENTIALS, MSG_INVALID_CREDENTIALS);
        } catch (StorageException e) {
            log.error("[REFRESH] Storage failure: {}", e.getMessage(), e);
            result = internal();
        }
        metrics.record(Operation.REFRESH, outcome(result), start);
        return result;
    }

    /**
     * Revoke a refresh token. Unknown or already-used tokens succeed as well.
     */
    public ServiceResult<Void> logout(String refreshToken) {
        long start = System.nanoTime();
        ServiceResult<Void> result;
        try {
            boolean revoked = tokenIssuer.revoke(refreshToken);
            log.debug("[LOGOUT] Refresh token revoked: {}", revoked);
            result = ServiceResult.success(null);
        } catch (StorageException e) {
            log.error("[LOGOUT] Storage failure: {}", e.getMessage(), e);
            result = internal();
        }
        metrics.record(Operation.LOGOUT, outcome(result), start);
        return result;
    }

    /**
     * Resolve the user behind an access token.
     */
    public ServiceResult<User> authenticate(String accessToken) {
        long start = System.nanoTime();
        ServiceResult<User> result;
        try {
            UUID userId = tokenIssuer.verifyAccessToken(accessToken);
            result = userRepository.findById(userId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ErrorKind.INVALID_CREDENTIALS, MSG_INVALID_CREDENTIALS));
        } catch (InvalidTokenException e) {
            log.debug("[AUTH] Rejected access token: {}", e.getReason());
            result = ServiceResult.failure(ErrorKind.INVALID_CREDENTIALS, MSG_INVALID_CREDENTIALS);
        } catch (StorageException e) {
            log.error("[AUTH] Storage failure: {}", e.getMessage(), e);
            result = internal();
        }
        metrics.record(Operation.AUTHENTICATE, outcome(result), start);
        return result;
    }

    public ServiceResult<User> getUser(UUID userId) {
        try {
            return userRepository.findById(userId)
                .map(ServiceResult::success)
                .orElseGet(() -> ServiceResult.failure(ErrorKind.NOT_FOUND, MSG_NOT_FOUND));
        } catch (StorageException e) {
            log.error("[USER] Storage failure looking up {}: {}", userId, e.getMessage(), e);
            return internal();
        }
    }

    /**
     * Administrative removal. Outstanding refresh tokens are removed with the user; access tokens
     * stop resolving through {@link #authenticate(String)}.
     */
    public ServiceResult<Void> deleteUser(UUID userId) {
        try {
            if (!userRepository.delete(userId)) {
                return ServiceResult.failure(ErrorKind.NOT_FOUND, MSG_NOT_FOUND);
            }
            log.info("[ADMIN] User deleted: {}", userId);
            return ServiceResult.success(null);
        } catch (StorageException e) {
            log.error("[ADMIN] Storage failure deleting {}: {}", userId, e.getMessage(), e);
            return internal();
        }
    }

    private static <T> ServiceResult<T> internal() {
        return ServiceResult.failure(ErrorKind.INTERNAL, MSG_INTERNAL);
    }

    private static String outcome(ServiceResult<?> result) {
        return result.success() ? "success" : result.error().name();
    }

    private static String randomSecret() {
        byte[] bytes = new byte[24];
        new SecureRandom().nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }
}
