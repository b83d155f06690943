package dev.catananti.passwordlab.model;

import java.util.Set;

/**
 * Outcome of scoring one password. The level is always derived from the clamped score.
 */
public record StrengthResult(
        int score,
        StrengthLevel level,
        int length,
        double entropyBits,
        CharacterSetProfile charSets,
        boolean common,
        Set<PatternType> patterns
) {

    public StrengthResult {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        if (level != StrengthLevel.fromScore(score)) {
            throw new IllegalArgumentException("Level " + level + " does not match score " + score);
        }
        patterns = Set.copyOf(patterns);
    }

    public boolean hasPatterns() {
        return !patterns.isEmpty();
    }
}
