package io.sultan.auth;

import io.sultan.auth.InvalidTokenException.Reason;
import io.sultan.domain.user.RefreshToken;
import io.sultan.repository.RefreshTokenRepository;
import io.sultan.repository.RefreshTokenRepository.RotationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Issues and validates session tokens.
 *
 * Access tokens are self-verifying JWTs (see {@link JwtService}). Refresh tokens are opaque random
 * strings; only their SHA-256 is stored, together with expiry and consumption state, so a refresh
 * token cannot be used as an access token and a leaked table cannot be replayed.
 */
public final class TokenIssuer {
    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final int REFRESH_TOKEN_BYTES = 32;
    private static final Pattern REFRESH_TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{43}$");

    private final JwtService jwtService;
    private final RefreshTokenRepository refreshTokens;
    private final Duration refreshTtl;
    private final Clock clock;

    public TokenIssuer(JwtService jwtService, RefreshTokenRepository refreshTokens, Duration refreshTtl, Clock clock) {
        if (refreshTtl.compareTo(jwtService.ttl()) <= 0) {
            throw new IllegalArgumentException("Refresh token TTL must be longer than access token TTL");
        }
        this.jwtService = jwtService;
        this.refreshTokens = refreshTokens;
        this.refreshTtl = refreshTtl;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(UUID userId) {
        return jwtService.generate(userId);
    }

    /**
     * @throws InvalidTokenException if the token is malformed, forged or expired
     */
    public UUID verifyAccessToken(String token) {
        return jwtService.validate(token);
    }

    public IssuedToken issueRefreshToken(UUID userId) {
        Instant now = clock.instant();
        String token = newRefreshToken();
        Instant expiresAt = now.plus(refreshTtl);
        refreshTokens.insert(RefreshToken.issued(hash(token), userId, now, expiresAt));
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Access token plus refresh token, as handed out at login.
     */
    public TokenPair issuePair(UUID userId) {
        IssuedToken refresh = issueRefreshToken(userId);
        IssuedToken access = issueAccessToken(userId);
        return new TokenPair(access, refresh);
    }

    /**
     * Exchange a refresh token for a new pair. The presented token is consumed; presenting it
     * again fails with {@link Reason#CONSUMED}.
     *
     * @throws InvalidTokenException MALFORMED, UNKNOWN, EXPIRED or CONSUMED
     */
    public TokenPair rotate(String refreshToken) {
        checkShape(refreshToken);

        Instant now = clock.instant();
        String successor = newRefreshToken();
        Instant successorExpiresAt = now.plus(refreshTtl);

        RotationResult result = refreshTokens.rotate(hash(refreshToken), hash(successor), successorExpiresAt, now);
        switch (result.outcome()) {
            case ROTATED:
                break;
            case EXPIRED:
                throw new InvalidTokenException(Reason.EXPIRED, "Refresh token expired");
            case CONSUMED:
                log.warn("[ROTATE] Refresh token presented after it was already used");
                throw new InvalidTokenException(Reason.CONSUMED, "Refresh token already used");
            default:
                throw new InvalidTokenException(Reason.UNKNOWN, "Refresh token not recognised");
        }

        log.debug("[ROTATE] Rotated refresh token for user {}", result.userId());
        IssuedToken access = issueAccessToken(result.userId());
        return new TokenPair(access, new IssuedToken(successor, successorExpiresAt));
    }

    /**
     * Revoke a refresh token without issuing a successor.
     *
     * @return true if a live token was revoked
     */
    public boolean revoke(String refreshToken) {
        if (refreshToken == null || !REFRESH_TOKEN_PATTERN.matcher(refreshToken).matches()) {
            return false;
        }
        return refreshTokens.revoke(hash(refreshToken), clock.instant());
    }

    /**
     * Drop stored refresh tokens whose expiry has passed.
     */
    public int purgeExpired() {
        return refreshTokens.deleteExpired(clock.instant());
    }

    private static void checkShape(String refreshToken) {
        if (refreshToken == null || !REFRESH_TOKEN_PATTERN.matcher(refreshToken).matches()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Refresh token has an invalid format");
        }
    }

    private static String newRefreshToken() {
        byte[] bytes = new byte[REFRESH_TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
