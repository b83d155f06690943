package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.model.GenerationSpec;
import dev.catananti.passwordlab.util.CharacterPools;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cryptographically random passwords drawn only from the requested classes.
 * One character of every requested class is placed first and the result shuffled, so each class is
 * guaranteed to appear.
 */
@Component
public class PasswordGenerator {

    private final SecureRandom random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    PasswordGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate(GenerationSpec spec) {
        List<String> pools = selectedPools(spec);
        String union = String.join("", pools);

        List<Character> chars = new ArrayList<>(spec.length());
        for (String pool : pools) {
            chars.add(CharacterPools.pick(pool, random));
        }
        while (chars.size() < spec.length()) {
            chars.add(CharacterPools.pick(union, random));
        }
        Collections.shuffle(chars, random);

        StringBuilder sb = new StringBuilder(spec.length());
        chars.forEach(sb::append);
        return sb.toString();
    }

    private static List<String> selectedPools(GenerationSpec spec) {
        List<String> pools = new ArrayList<>(4);
        if (spec.includeLowercase()) pools.add(CharacterPools.LOWERCASE);
        if (spec.includeUppercase()) pools.add(CharacterPools.UPPERCASE);
        if (spec.includeDigits()) pools.add(CharacterPools.DIGITS);
        if (spec.includeSpecial()) pools.add(CharacterPools.SPECIAL);
        return pools;
    }
}
