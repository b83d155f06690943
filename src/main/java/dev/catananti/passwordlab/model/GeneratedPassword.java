package dev.catananti.passwordlab.model;

public record GeneratedPassword(String password, StrengthResult strength) {
}
