package dev.catananti.passwordlab.model;

public enum SuggestionSeverity {
    CRITICAL("[CRITICAL]"),
    WARNING("[WARNING]"),
    GOOD_PRACTICE("[TIP]"),
    NEUTRAL("[OK]");

    private final String marker;

    SuggestionSeverity(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
