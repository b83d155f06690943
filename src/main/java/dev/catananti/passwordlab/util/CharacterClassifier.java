package dev.catananti.passwordlab.util;

import dev.catananti.passwordlab.model.CharacterSetProfile;

/**
 * Utility class detecting which symbol classes a password uses.
 * Letters and digits are ASCII only; any other non-control code point counts as special.
 */
public final class CharacterClassifier {

    private CharacterClassifier() {
    }

    public static CharacterSetProfile classify(String password) {
        if (password == null || password.isEmpty()) {
            return CharacterSetProfile.EMPTY;
        }
        boolean lower = false;
        boolean upper = false;
        boolean digit = false;
        boolean special = false;
        for (int cp : password.codePoints().toArray()) {
            if (isLowercase(cp)) {
                lower = true;
            } else if (isUppercase(cp)) {
                upper = true;
            } else if (isDigit(cp)) {
                digit = true;
            } else if (isSpecial(cp)) {
                special = true;
            }
        }
        return new CharacterSetProfile(lower, upper, digit, special);
    }

    public static boolean isLowercase(int codePoint) {
        return codePoint >= 'a' && codePoint <= 'z';
    }

    public static boolean isUppercase(int codePoint) {
        return codePoint >= 'A' && codePoint <= 'Z';
    }

    public static boolean isDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }

    public static boolean isSpecial(int codePoint) {
        return !isLowercase(codePoint) && !isUppercase(codePoint) && !isDigit(codePoint)
                && !Character.isISOControl(codePoint);
    }

    public static boolean isAsciiLetter(int codePoint) {
        return isLowercase(codePoint) || isUppercase(codePoint);
    }
}
