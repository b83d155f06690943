package dev.catananti.passwordlab.model;

import dev.catananti.passwordlab.exception.InvalidSpecException;

/**
 * Parameters for the random password generator.
 * Construction validates the spec, so an instance is always generatable.
 */
public record GenerationSpec(
        int length,
        boolean includeLowercase,
        boolean includeUppercase,
        boolean includeDigits,
        boolean includeSpecial
) {

    public static final int MIN_LENGTH = 8;
    public static final int MAX_LENGTH = 128;
    public static final int DEFAULT_LENGTH = 16;

    public GenerationSpec {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new InvalidSpecException(
                    "Length must be between " + MIN_LENGTH + " and " + MAX_LENGTH + " (was " + length + ")");
        }
        if (!includeLowercase && !includeUppercase && !includeDigits && !includeSpecial) {
            throw new InvalidSpecException("At least one character type must be selected");
        }
    }

    public static GenerationSpec allClasses(int length) {
        return new GenerationSpec(length, true, true, true, true);
    }
}
