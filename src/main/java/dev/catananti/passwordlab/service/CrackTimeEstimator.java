package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.config.AttackSpeedPolicy;
import dev.catananti.passwordlab.model.CrackTimeEntry;
import dev.catananti.passwordlab.model.HashAlgorithm;
import dev.catananti.passwordlab.util.CrackTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects average-case brute-force time for every storage scheme.
 *
 * <p>The keyspace is {@code 2^entropyBits} for all schemes; a dictionary hit is modelled as a
 * keyspace of one. Half the keyspace is searched on average. The arithmetic runs in log10 space and
 * saturates at {@link Double#MAX_VALUE} seconds.
 */
@Component
@RequiredArgsConstructor
public class CrackTimeEstimator {

    private static final double LOG10_2 = Math.log10(2);
    private static final double MAX_LOG10_SECONDS = Math.log10(Double.MAX_VALUE);

    private final AttackSpeedPolicy attackSpeeds;

    public List<CrackTimeEntry> estimate(double entropyBits, boolean common) {
        double log10Keyspace = common ? 0.0 : Math.max(0.0, entropyBits) * LOG10_2;
        List<CrackTimeEntry> entries = new ArrayList<>(HashAlgorithm.values().length);
        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            double speed = attackSpeeds.speedOf(algorithm);
            double log10Seconds = log10Keyspace - Math.log10(2 * speed);
            double seconds = log10Seconds >= MAX_LOG10_SECONDS ? Double.MAX_VALUE : Math.pow(10, log10Seconds);
            entries.add(new CrackTimeEntry(algorithm, speed, seconds, CrackTimeFormatter.format(seconds)));
        }
        return List.copyOf(entries);
    }
}
