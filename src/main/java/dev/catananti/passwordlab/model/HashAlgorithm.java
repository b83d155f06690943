package dev.catananti.passwordlab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Credential-storage schemes compared by the lab, in fixed display order
 * from fastest to slowest to attack.
 */
public enum HashAlgorithm {
    PLAIN_TEXT("plaintext", "Plain Text"),
    MD5("md5", "MD5"),
    SHA256("sha256", "SHA256"),
    BCRYPT("bcrypt", "bcrypt"),
    ARGON2("argon2", "Argon2");

    private final String key;
    private final String displayName;

    HashAlgorithm(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
