package dev.catananti.passwordlab.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Weights and thresholds of the strength score. Policy choices, not derived values.
 *
 * <p>Tier tables are written as {@code threshold:points} pairs; a value earns the points of the
 * highest threshold it reaches, so every table is monotonic by construction.
 *
 * <pre>
 * password-lab.scoring.length-tiers=6:5,8:15,12:25,16:35
 * password-lab.scoring.entropy-tiers=28:5,40:10,60:15,80:20
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ScoringPolicy {

    public static final String DEFAULT_LENGTH_TIERS = "6:5,8:15,12:25,16:35";
    public static final String DEFAULT_ENTROPY_TIERS = "28:5,40:10,60:15,80:20";

    private final NavigableMap<Integer, Integer> lengthTiers;
    private final NavigableMap<Integer, Integer> entropyTiers;
    private final int diversityMaxPoints;
    private final int recommendedLength;
    private final int bestPracticeMinClasses;
    private final int combinedPracticeBonus;
    private final int noRepeatBonus;
    private final int commonPasswordPenalty;
    private final int patternPenalty;

    public ScoringPolicy(
            @Value("${password-lab.scoring.length-tiers:" + DEFAULT_LENGTH_TIERS + "}") String lengthTiers,
            @Value("${password-lab.scoring.entropy-tiers:" + DEFAULT_ENTROPY_TIERS + "}") String entropyTiers,
            @Value("${password-lab.scoring.diversity-max-points:30}") int diversityMaxPoints,
            @Value("${password-lab.scoring.recommended-length:12}") int recommendedLength,
            @Value("${password-lab.scoring.best-practice-min-classes:3}") int bestPracticeMinClasses,
            @Value("${password-lab.scoring.combined-practice-bonus:10}") int combinedPracticeBonus,
            @Value("${password-lab.scoring.no-repeat-bonus:5}") int noRepeatBonus,
            @Value("${password-lab.scoring.common-password-penalty:50}") int commonPasswordPenalty,
            @Value("${password-lab.scoring.pattern-penalty:20}") int patternPenalty
    ) {
        this.lengthTiers = parseTiers(lengthTiers);
        this.entropyTiers = parseTiers(entropyTiers);
        this.diversityMaxPoints = diversityMaxPoints;
        this.recommendedLength = recommendedLength;
        this.bestPracticeMinClasses = bestPracticeMinClasses;
        this.combinedPracticeBonus = combinedPracticeBonus;
        this.noRepeatBonus = noRepeatBonus;
        this.commonPasswordPenalty = commonPasswordPenalty;
        this.patternPenalty = patternPenalty;
        log.info("Scoring policy initialized: length tiers {}, entropy tiers {}", this.lengthTiers, this.entropyTiers);
    }

    /**
     * The shipped policy, for use outside a Spring context.
     */
    public static ScoringPolicy defaults() {
        return new ScoringPolicy(DEFAULT_LENGTH_TIERS, DEFAULT_ENTROPY_TIERS, 30, 12, 3, 10, 5, 50, 20);
    }

    public int lengthPoints(int length) {
        return tierPoints(lengthTiers, length);
    }

    public int entropyPoints(double entropyBits) {
        return tierPoints(entropyTiers, (int) Math.floor(entropyBits));
    }

    public double diversityPointsPerClass() {
        return diversityMaxPoints / 4.0;
    }

    private static int tierPoints(NavigableMap<Integer, Integer> tiers, int value) {
        var tier = tiers.floorEntry(value);
        return tier == null ? 0 : tier.getValue();
    }

    static NavigableMap<Integer, Integer> parseTiers(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalStateException("Tier table must not be empty");
        }
        NavigableMap<Integer, Integer> tiers = new TreeMap<>();
        for (String pair : spec.split(",")) {
            String[] parts = pair.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalStateException("Malformed tier '" + pair + "', expected threshold:points");
            }
            try {
                tiers.put(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Malformed tier '" + pair + "'", e);
            }
        }
        int previous = Integer.MIN_VALUE;
        for (int points : tiers.values()) {
            if (points < previous) {
                throw new IllegalStateException("Tier points must not decrease with the threshold: " + spec);
            }
            previous = points;
        }
        return Collections.unmodifiableNavigableMap(tiers);
    }
}
