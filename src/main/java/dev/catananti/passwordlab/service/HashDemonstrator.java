package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.exception.BackendUnavailableException;
import dev.catananti.passwordlab.model.HashAlgorithm;
import dev.catananti.passwordlab.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hashes a password with each storage scheme for side-by-side display.
 *
 * <p>Bcrypt and Argon2 run with deliberately low cost settings so a request stays fast. They are
 * for demonstration only and must not be reused for real credential storage.
 */
@Component
@Slf4j
public class HashDemonstrator {

    static final String ARGON2_BACKEND_CLASS = "org.bouncycastle.crypto.generators.Argon2BytesGenerator";

    private static final int ARGON2_SALT_LENGTH = 16;
    private static final int ARGON2_HASH_LENGTH = 32;
    private static final int ARGON2_PARALLELISM = 1;
    static final int BCRYPT_MAX_BYTES = 72;

    private final PasswordEncoder bcrypt;
    private final PasswordEncoder argon2;

    @Autowired
    public HashDemonstrator(
            @Value("${password-lab.hashing.bcrypt-cost:6}") int bcryptCost,
            @Value("${password-lab.hashing.argon2.memory-kib:4096}") int argon2MemoryKib,
            @Value("${password-lab.hashing.argon2.iterations:2}") int argon2Iterations) {
        this(bcryptCost, argon2MemoryKib, argon2Iterations,
                ClassUtils.isPresent(ARGON2_BACKEND_CLASS, HashDemonstrator.class.getClassLoader()));
    }

    HashDemonstrator(int bcryptCost, int argon2MemoryKib, int argon2Iterations, boolean argon2Available) {
        this.bcrypt = new BCryptPasswordEncoder(bcryptCost);
        this.argon2 = argon2Available
                ? new Argon2PasswordEncoder(ARGON2_SALT_LENGTH, ARGON2_HASH_LENGTH, ARGON2_PARALLELISM,
                        argon2MemoryKib, argon2Iterations)
                : null;
        if (argon2 == null) {
            log.warn("Argon2 backend not found on the classpath, Argon2 hashes will be omitted");
        }
    }

    public static HashDemonstrator withDefaults() {
        return new HashDemonstrator(6, 4096, 2);
    }

    public boolean isArgon2Available() {
        return argon2 != null;
    }

    public boolean isAvailable(HashAlgorithm algorithm) {
        return algorithm != HashAlgorithm.ARGON2 || isArgon2Available();
    }

    /**
     * Digests for MD5, SHA-256, bcrypt and, when available, Argon2id. The plaintext is never included.
     */
    public Map<HashAlgorithm, String> demonstrate(String password) {
        Map<HashAlgorithm, String> hashes = new LinkedHashMap<>();
        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            if (algorithm != HashAlgorithm.PLAIN_TEXT && isAvailable(algorithm)) {
                hashes.put(algorithm, hash(algorithm, password));
            }
        }
        return hashes;
    }

    public String hash(HashAlgorithm algorithm, String password) {
        return switch (algorithm) {
            case PLAIN_TEXT -> throw new IllegalArgumentException("Plain text storage involves no hash");
            case MD5 -> DigestUtils.md5Hex(password);
            case SHA256 -> DigestUtils.sha256Hex(password);
            case BCRYPT -> bcrypt.encode(bcryptInput(password));
            case ARGON2 -> requireArgon2().encode(password);
        };
    }

    public boolean matches(HashAlgorithm algorithm, String password, String digest) {
        return switch (algorithm) {
            case PLAIN_TEXT -> password.equals(digest);
            case MD5 -> DigestUtils.md5Hex(password).equals(digest);
            case SHA256 -> DigestUtils.sha256Hex(password).equals(digest);
            case BCRYPT -> bcrypt.matches(bcryptInput(password), digest);
            case ARGON2 -> requireArgon2().matches(password, digest);
        };
    }

    /**
     * bcrypt only reads the first 72 bytes of its input. Longer passwords are cut at a code point
     * boundary before hashing so every encoder version treats them the same way.
     */
    static String bcryptInput(String password) {
        if (password.getBytes(StandardCharsets.UTF_8).length <= BCRYPT_MAX_BYTES) {
            return password;
        }
        StringBuilder kept = new StringBuilder();
        int bytes = 0;
        for (int cp : password.codePoints().toArray()) {
            int size = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > BCRYPT_MAX_BYTES) {
                break;
            }
            kept.appendCodePoint(cp);
            bytes += size;
        }
        return kept.toString();
    }

    private PasswordEncoder requireArgon2() {
        if (argon2 == null) {
            throw new BackendUnavailableException(HashAlgorithm.ARGON2);
        }
        return argon2;
    }
}
