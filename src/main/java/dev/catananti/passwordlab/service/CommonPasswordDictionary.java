package dev.catananti.passwordlab.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Blocklist of widely known and breached passwords, loaded once and never modified.
 * Lookups are exact and case-insensitive.
 */
@Component
@Slf4j
public class CommonPasswordDictionary {

    public static final String DEFAULT_LOCATION = "common-passwords.txt";

    private final Set<String> passwords;

    @Autowired
    public CommonPasswordDictionary(@Value("${password-lab.common-passwords:" + DEFAULT_LOCATION + "}") String location) {
        this(new ClassPathResource(location));
    }

    CommonPasswordDictionary(Resource resource) {
        this.passwords = load(resource);
        log.info("Loaded {} common passwords from {}", passwords.size(), resource.getDescription());
    }

    public static CommonPasswordDictionary fromClasspath() {
        return new CommonPasswordDictionary(DEFAULT_LOCATION);
    }

    public boolean isCommon(String password) {
        return password != null && passwords.contains(normalize(password));
    }

    public int size() {
        return passwords.size();
    }

    private static Set<String> load(Resource resource) {
        Set<String> loaded = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.strip();
                // '#' starts a comment line
                if (!entry.isEmpty() && !entry.startsWith("#")) {
                    loaded.add(normalize(entry));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load common password list " + resource.getDescription(), e);
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("Common password list " + resource.getDescription() + " is empty");
        }
        return Set.copyOf(loaded);
    }

    private static String normalize(String password) {
        return password.toLowerCase(Locale.ROOT);
    }
}
