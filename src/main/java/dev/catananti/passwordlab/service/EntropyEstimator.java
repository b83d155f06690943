package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.PatternScan;
import dev.catananti.passwordlab.model.PatternType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Estimates brute-force entropy from alphabet size and length, discounting predictable characters.
 *
 * <p>Each code point contributes {@code log2(alphabetSize)} bits multiplied by the entropy weight of
 * the pattern it continues (see {@link PatternType}). With no pattern this is the classic
 * {@code length * log2(alphabetSize)}.
 */
@Component
@RequiredArgsConstructor
public class EntropyEstimator {

    private final PatternDetector patternDetector;

    public double estimate(String password, CharacterSetProfile profile) {
        return estimate(profile, patternDetector.scan(password));
    }

    public double estimate(CharacterSetProfile profile, PatternScan scan) {
        int alphabetSize = profile.alphabetSize();
        if (alphabetSize <= 1 || scan.positions().isEmpty()) {
            return 0.0;
        }
        double bitsPerCharacter = log2(alphabetSize);
        double bits = 0.0;
        for (PatternType type : scan.positions()) {
            bits += bitsPerCharacter * type.entropyWeight();
        }
        return bits;
    }

    public static double round2(double bits) {
        return Math.round(bits * 100.0) / 100.0;
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
