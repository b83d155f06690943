package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.model.AlgorithmInfo;
import dev.catananti.passwordlab.model.HashAlgorithm;
import dev.catananti.passwordlab.model.PasswordExample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only reference data for the front end: algorithm cards and quick-test examples.
 */
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

    static final List<AlgorithmInfo> ALGORITHMS = List.of(
            new AlgorithmInfo(HashAlgorithm.PLAIN_TEXT, "Plain Text", "insecure", "1000 trillion H/s",
                    "No protection - passwords visible to anyone with database access",
                    "NEVER use in production systems", "N/A", null),
            new AlgorithmInfo(HashAlgorithm.MD5, "MD5", "deprecated", "180 billion H/s",
                    "Fast hashing = fast cracking. Vulnerable to rainbow tables",
                    "Do not use for passwords", "Deprecated since 2004", null),
            new AlgorithmInfo(HashAlgorithm.SHA256, "SHA256", "weak", "65 billion H/s",
                    "Better than MD5 but still too fast. No built-in salting",
                    "Use for checksums, NOT for passwords", "Not suitable for passwords", null),
            new AlgorithmInfo(HashAlgorithm.BCRYPT, "bcrypt", "secure", "85 thousand H/s",
                    "Slow by design, includes salt, adjustable cost factor",
                    "Recommended for password storage", "Since 1999", null),
            new AlgorithmInfo(HashAlgorithm.ARGON2, "Argon2", "most_secure", "1 thousand H/s",
                    "Winner of the Password Hashing Competition, memory-hard",
                    "Best choice for new systems", "Since 2015", null)
    );

    // Expected scores are what the default scoring policy produces
    static final List<PasswordExample> EXAMPLES = List.of(
            new PasswordExample("password", "Very Weak - Common Password", 0),
            new PasswordExample("Pass123", "Very Weak - Short & Predictable", 18),
            new PasswordExample("MyP@ssw0rd", "Strong - Complex but Short", 65),
            new PasswordExample("Tr0ub4dor&3", "Strong - Good Mix", 65),
            new PasswordExample("correct-horse-battery-staple-2024", "Very Strong - Long Passphrase", 93)
    );

    private final HashDemonstrator hashDemonstrator;

    public List<AlgorithmInfo> algorithms() {
        return ALGORITHMS.stream()
                .map(info -> info.algorithm() == HashAlgorithm.ARGON2
                        ? info.withAvailability(hashDemonstrator.isArgon2Available())
                        : info)
                .toList();
    }

    public List<PasswordExample> examples() {
        return EXAMPLES;
    }
}
