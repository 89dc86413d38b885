package io.sultan.auth;

import io.sultan.config.AppConfig.HashingParams;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Argon2id password hasher.
 *
 * Output is the PHC string format, e.g.
 * <pre>
 * $argon2id$v=19$m=19456,t=2,p=1$&lt;salt&gt;$&lt;hash&gt;
 * </pre>
 * Verification reads the parameters back from the stored string, so raising the work factor
 * later does not invalidate existing hashes.
 */
public final class Argon2PasswordHasher implements PasswordHasher {
    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;

    private static final Pattern PHC_PATTERN = Pattern.compile(
        "^\\$argon2(id|i|d)\\$v=(16|19)\\$m=(\\d{1,10}),t=(\\d{1,10}),p=(\\d{1,3})"
            + "\\$([A-Za-z0-9+/]+={0,2})\\$([A-Za-z0-9+/]+={0,2})$");

    private final Argon2PasswordEncoder encoder;

    public Argon2PasswordHasher(HashingParams params) {
        if (params.memoryKib() < 8 * params.parallelism()) {
            throw new IllegalArgumentException("Argon2 memory must be at least 8 KiB per lane");
        }
        if (params.iterations() < 1 || params.parallelism() < 1) {
            throw new IllegalArgumentException("Argon2 iterations and parallelism must be positive");
        }
        this.encoder = new Argon2PasswordEncoder(
            SALT_LENGTH, HASH_LENGTH, params.parallelism(), params.memoryKib(), params.iterations());
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new HashingException("Cannot hash a null password");
        }
        try {
            return encoder.encode(plaintext);
        } catch (OutOfMemoryError e) {
            throw new HashingException("Password hashing ran out of memory", e);
        } catch (RuntimeException e) {
            throw new HashingException("Password hashing failed", e);
        }
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null) {
            return false;
        }
        checkWellFormed(hash);
        try {
            return encoder.matches(plaintext, hash);
        } catch (OutOfMemoryError e) {
            throw new HashingException("Password verification ran out of memory", e);
        }
    }

    /**
     * Argon2PasswordEncoder treats a corrupt hash as a mismatch, so the structure is checked here
     * first to keep "wrong password" and "corrupt data" apart.
     */
    private static void checkWellFormed(String hash) {
        if (hash == null || hash.isEmpty()) {
            throw new HashingException("Stored password hash is empty");
        }
        Matcher m = PHC_PATTERN.matcher(hash);
        if (!m.matches()) {
            throw new HashingException("Stored password hash is not a valid Argon2 PHC string");
        }
        try {
            long memory = Long.parseLong(m.group(3));
            long iterations = Long.parseLong(m.group(4));
            int parallelism = Integer.parseInt(m.group(5));
            if (memory > Integer.MAX_VALUE || iterations > Integer.MAX_VALUE
                    || iterations < 1 || parallelism < 1 || memory < 8L * parallelism) {
                throw new HashingException("Stored password hash has invalid Argon2 parameters");
            }
            Base64.Decoder decoder = Base64.getDecoder();
            if (decoder.decode(m.group(6)).length == 0 || decoder.decode(m.group(7)).length == 0) {
                throw new HashingException("Stored password hash has an empty salt or digest");
            }
        } catch (IllegalArgumentException e) {
            throw new HashingException("Stored password hash has an invalid encoding", e);
        }
    }
}
