package io.sultan.auth;

/**
 * One-way password hashing.
 *
 * Implementations produce self-describing hash strings (algorithm, parameters and salt embedded),
 * so nothing besides the string itself is needed to verify later.
 */
public interface PasswordHasher {

    /**
     * Hash a plaintext password with a fresh random salt.
     *
     * @throws HashingException if the input is unusable or hashing runs out of resources
     */
    String hash(String plaintext);

    /**
     * Check a plaintext password against a stored hash in constant time.
     *
     * @return false when the hash is well-formed but does not match
     * @throws HashingException if the stored hash is malformed
     */
    boolean verify(String plaintext, String hash);
}
