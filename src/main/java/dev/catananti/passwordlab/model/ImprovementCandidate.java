package dev.catananti.passwordlab.model;

/**
 * A modified password together with its authoritative re-score.
 */
public record ImprovementCandidate(
        String password,
        int score,
        StrengthLevel level,
        int length,
        ImprovementStrategy strategy,
        String description
) {
}
