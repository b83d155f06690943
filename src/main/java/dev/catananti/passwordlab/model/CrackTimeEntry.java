package dev.catananti.passwordlab.model;

/**
 * Average-case brute-force time for one storage scheme.
 */
public record CrackTimeEntry(
        HashAlgorithm algorithm,
        double attackSpeedHashesPerSecond,
        double timeSeconds,
        String timeHuman
) {
}
