package dev.catananti.passwordlab.model;

/**
 * One advisory line. {@link #text()} carries the severity as a textual marker.
 */
public record Suggestion(SuggestionSeverity severity, String message) {

    public static Suggestion critical(String message) {
        return new Suggestion(SuggestionSeverity.CRITICAL, message);
    }

    public static Suggestion warning(String message) {
        return new Suggestion(SuggestionSeverity.WARNING, message);
    }

    public static Suggestion tip(String message) {
        return new Suggestion(SuggestionSeverity.GOOD_PRACTICE, message);
    }

    public static Suggestion neutral(String message) {
        return new Suggestion(SuggestionSeverity.NEUTRAL, message);
    }

    public String text() {
        return severity.marker() + " " + message;
    }
}
