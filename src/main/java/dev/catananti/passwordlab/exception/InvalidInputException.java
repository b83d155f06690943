package dev.catananti.passwordlab.exception;

/**
 * Thrown when a password is missing or empty where one is required.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
