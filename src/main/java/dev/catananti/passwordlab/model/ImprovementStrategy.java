package dev.catananti.passwordlab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImprovementStrategy {
    ADD_MISSING_CLASSES("Added missing character types"),
    EXTEND_LENGTH("Added characters"),
    SUBSTITUTE("Character substitution"),
    COMBINED("Combined substitution and extension"),
    PASSPHRASE("Passphrase creation");

    private final String label;

    ImprovementStrategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
