package io.sultan.auth;

import io.sultan.config.AppConfig.HashingParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Argon2PasswordHasherTest {

    // Cheap work factor; production defaults are exercised by the config tests
    private static final HashingParams FAST = new HashingParams(1024, 1, 1);

    private Argon2PasswordHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new Argon2PasswordHasher(FAST);
    }

    @Test
    @DisplayName("Hash is an argon2id PHC string carrying its parameters")
    void hashUsesPhcFormat() {
        String hash = hasher.hash("correct horse battery");

        assertTrue(hash.startsWith("$argon2id$v=19$m=1024,t=1,p=1$"), hash);
        assertFalse(hash.contains("correct horse battery"));
    }

    @Test
    @DisplayName("Same password hashed twice gives different salted hashes that both verify")
    void hashIsSalted() {
        String first = hasher.hash("s3cretpass");
        String second = hasher.hash("s3cretpass");

        assertNotEquals(first, second);
        assertTrue(hasher.verify("s3cretpass", first));
        assertTrue(hasher.verify("s3cretpass", second));
    }

    @Test
    void verifyReturnsFalseForWrongPassword() {
        String hash = hasher.hash("s3cretpass");

        assertFalse(hasher.verify("s3cretpasS", hash));
        assertFalse(hasher.verify("", hash));
        assertFalse(hasher.verify(null, hash));
    }

    @Test
    @DisplayName("Hashes made with other parameters still verify")
    void verifyReadsParametersFromHash() {
        String hash = new Argon2PasswordHasher(new HashingParams(2048, 2, 1)).hash("s3cretpass");

        assertTrue(hasher.verify("s3cretpass", hash));
    }

    @Test
    @DisplayName("Malformed stored hash is a hashing failure, not a mismatch")
    void verifyRejectsMalformedHash() {
        assertThrows(HashingException.class, () -> hasher.verify("s3cretpass", "not-a-hash"));
        assertThrows(HashingException.class, () -> hasher.verify("s3cretpass", ""));
        assertThrows(HashingException.class, () -> hasher.verify("s3cretpass", null));
        assertThrows(HashingException.class,
            () -> hasher.verify("s3cretpass", "$argon2id$v=19$m=1024,t=0,p=1$c2FsdHNhbHQ$aGFzaGhhc2g"));
        assertThrows(HashingException.class,
            () -> hasher.verify("s3cretpass", "$argon2id$v=19$m=1024,t=1,p=1$$aGFzaGhhc2g"));
        assertThrows(HashingException.class,
            () -> hasher.verify("s3cretpass", "$2a$10$abcdefghijklmnopqrstuv"));
    }

    @Test
    void hashRejectsNull() {
        assertThrows(HashingException.class, () -> hasher.hash(null));
    }

    @Test
    void constructorRejectsTooLittleMemory() {
        assertThrows(IllegalArgumentException.class, () -> new Argon2PasswordHasher(new HashingParams(4, 1, 1)));
        assertThrows(IllegalArgumentException.class, () -> new Argon2PasswordHasher(new HashingParams(1024, 0, 1)));
    }
}
