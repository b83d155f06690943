package dev.catananti.passwordlab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Which symbol classes a password uses.
 * Alphabet sizes are the ones the entropy estimate assumes for each class.
 */
public record CharacterSetProfile(
        boolean lowercase,
        boolean uppercase,
        boolean digits,
        boolean special
) {

    public static final int LOWERCASE_SIZE = 26;
    public static final int UPPERCASE_SIZE = 26;
    public static final int DIGIT_SIZE = 10;
    public static final int SPECIAL_SIZE = 32;

    public static final CharacterSetProfile EMPTY = new CharacterSetProfile(false, false, false, false);

    @JsonIgnore
    public int classCount() {
        int count = 0;
        if (lowercase) count++;
        if (uppercase) count++;
        if (digits) count++;
        if (special) count++;
        return count;
    }

    /**
     * Sum of the sizes of the classes present; 0 when nothing is present.
     */
    @JsonIgnore
    public int alphabetSize() {
        int size = 0;
        if (lowercase) size += LOWERCASE_SIZE;
        if (uppercase) size += UPPERCASE_SIZE;
        if (digits) size += DIGIT_SIZE;
        if (special) size += SPECIAL_SIZE;
        return size;
    }
}
