package dev.catananti.passwordlab.exception;

/**
 * Thrown when password generation parameters are out of range or select no character class.
 */
public class InvalidSpecException extends IllegalArgumentException {

    public InvalidSpecException(String message) {
        super(message);
    }
}
