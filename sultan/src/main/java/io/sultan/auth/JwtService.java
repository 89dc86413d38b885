package io.sultan.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sultan.auth.InvalidTokenException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * Access-token codec: compact HS256 JWTs.
 *
 * Claims: sub (user id), typ=access, jti (random), iat, exp (epoch seconds).
 * Stateless; verification needs only the shared secret.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final String ALGORITHM = "HmacSHA256";
    private static final String TOKEN_TYPE = "access";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final Base64.Encoder B64_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;
    private final String encodedHeader;

    public JwtService(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret must not be empty");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Access token TTL must be positive");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = ttl;
        this.clock = clock;
        this.encodedHeader = B64_ENCODER.encodeToString(
            "{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Generate an access token for the user.
     */
    public IssuedToken generate(UUID userId) {
        Instant now = clock.instant();
        long iat = now.getEpochSecond();
        long exp = now.plus(ttl).getEpochSecond();

        byte[] jti = new byte[16];
        RANDOM.nextBytes(jti);

        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", userId.toString());
        claims.put("typ", TOKEN_TYPE);
        claims.put("jti", B64_ENCODER.encodeToString(jti));
        claims.put("iat", iat);
        claims.put("exp", exp);

        String payload;
        try {
            payload = B64_ENCODER.encodeToString(MAPPER.writeValueAsBytes(claims));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode JWT claims", e);
        }

        String signingInput = encodedHeader + "." + payload;
        String signature = B64_ENCODER.encodeToString(sign(signingInput));
        return new IssuedToken(signingInput + "." + signature, Instant.ofEpochSecond(exp));
    }

    /**
     * Validate token and extract the user id.
     *
     * @throws InvalidTokenException for bad structure, bad signature, wrong type or expiry
     */
    public UUID validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token is empty");
        }
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token must have three segments");
        }

        byte[] presented;
        try {
            presented = B64_DECODER.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Signature is not base64url", e);
        }
        byte[] expected = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(expected, presented)) {
            log.debug("Invalid token signature");
            throw new InvalidTokenException(Reason.BAD_SIGNATURE, "Token signature mismatch");
        }

        // Signature verified; header and claims can be read now.
        JsonNode header = decodeSegment(parts[0]);
        if (!"HS256".equals(header.path("alg").asText())) {
            throw new InvalidTokenException(Reason.MALFORMED, "Unsupported token algorithm");
        }

        JsonNode claims = decodeSegment(parts[1]);
        if (!TOKEN_TYPE.equals(claims.path("typ").asText())) {
            throw new InvalidTokenException(Reason.MALFORMED, "Not an access token");
        }
        JsonNode sub = claims.get("sub");
        JsonNode exp = claims.get("exp");
        if (sub == null || !sub.isTextual() || exp == null || !exp.canConvertToLong()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Missing required claims");
        }

        if (clock.instant().getEpochSecond() >= exp.asLong()) {
            log.debug("Token expired");
            throw new InvalidTokenException(Reason.EXPIRED, "Access token expired");
        }

        try {
            return UUID.fromString(sub.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Subject is not a user id", e);
        }
    }

    private JsonNode decodeSegment(String segment) {
        try {
            JsonNode node = MAPPER.readTree(B64_DECODER.decode(segment));
            if (node == null || !node.isObject()) {
                throw new InvalidTokenException(Reason.MALFORMED, "Token segment is not a JSON object");
            }
            return node;
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token segment is not valid JSON", e);
        }
    }

    private byte[] sign(String data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }
}
