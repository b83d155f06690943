package dev.catananti.passwordlab.model;

public record PasswordExample(String password, String description, int expectedScore) {
}
