package dev.catananti.passwordlab.model;

/**
 * Predictable-character patterns and the share of a character's entropy that
 * survives when it continues one. The weights form a fixed discount table.
 */
public enum PatternType {
    NONE(1.0),
    /** Third or later of a run of identical characters, e.g. {@code aaa}. */
    REPEAT(0.25),
    /** Third or later of an ascending/descending letter or digit run, e.g. {@code abc}, {@code 321}. */
    SEQUENCE(0.35),
    /** Third or later of adjacent keys on one keyboard row, e.g. {@code qwe}, {@code lkj}. */
    KEYBOARD(0.50);

    private final double entropyWeight;

    PatternType(double entropyWeight) {
        this.entropyWeight = entropyWeight;
    }

    public double entropyWeight() {
        return entropyWeight;
    }
}
