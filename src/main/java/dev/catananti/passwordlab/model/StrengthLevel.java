package dev.catananti.passwordlab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete strength bands over the 0-100 score.
 * Thresholds are fixed: [0,20) [20,40) [40,60) [60,80) [80,100].
 */
public enum StrengthLevel {
    VERY_WEAK("Very Weak", 0),
    WEAK("Weak", 20),
    MODERATE("Moderate", 40),
    STRONG("Strong", 60),
    VERY_STRONG("Very Strong", 80);

    private final String label;
    private final int minScore;

    StrengthLevel(String label, int minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int minScore() {
        return minScore;
    }

    public static StrengthLevel fromScore(int score) {
        StrengthLevel[] levels = values();
        for (int i = levels.length - 1; i > 0; i--) {
            if (score >= levels[i].minScore) {
                return levels[i];
            }
        }
        return VERY_WEAK;
    }
}
