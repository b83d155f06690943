package dev.catananti.passwordlab.config;

import dev.catananti.passwordlab.model.HashAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Assumed attacker throughput per storage scheme, in hashes per second.
 * Defaults model a single high-end GPU running hashcat; bcrypt at cost 12, Argon2id at recommended settings.
 */
@Component
@Slf4j
public class AttackSpeedPolicy {

    private final Map<HashAlgorithm, Double> speeds;

    public AttackSpeedPolicy(
            @Value("${password-lab.attack-speeds.plaintext:1e15}") double plainText,
            @Value("${password-lab.attack-speeds.md5:1.8e11}") double md5,
            @Value("${password-lab.attack-speeds.sha256:6.5e10}") double sha256,
            @Value("${password-lab.attack-speeds.bcrypt:8.5e4}") double bcrypt,
            @Value("${password-lab.attack-speeds.argon2:1e3}") double argon2
    ) {
        Map<HashAlgorithm, Double> configured = new EnumMap<>(HashAlgorithm.class);
        configured.put(HashAlgorithm.PLAIN_TEXT, plainText);
        configured.put(HashAlgorithm.MD5, md5);
        configured.put(HashAlgorithm.SHA256, sha256);
        configured.put(HashAlgorithm.BCRYPT, bcrypt);
        configured.put(HashAlgorithm.ARGON2, argon2);
        validate(configured);
        this.speeds = Collections.unmodifiableMap(configured);
        log.info("Attack speed policy initialized: {}", speeds);
    }

    public static AttackSpeedPolicy defaults() {
        return new AttackSpeedPolicy(1e15, 1.8e11, 6.5e10, 8.5e4, 1e3);
    }

    public double speedOf(HashAlgorithm algorithm) {
        return speeds.get(algorithm);
    }

    // Crack times are only comparable when throughput falls strictly along the algorithm order
    private static void validate(Map<HashAlgorithm, Double> configured) {
        double previous = Double.POSITIVE_INFINITY;
        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            double speed = configured.get(algorithm);
            if (!(speed > 0) || Double.isInfinite(speed)) {
                throw new IllegalStateException("Attack speed for " + algorithm.key() + " must be a positive finite number");
            }
            if (speed >= previous) {
                throw new IllegalStateException("Attack speeds must strictly decrease from plaintext to argon2, "
                        + algorithm.key() + " is " + speed);
            }
            previous = speed;
        }
    }
}
