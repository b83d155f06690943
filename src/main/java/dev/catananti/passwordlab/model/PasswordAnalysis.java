package dev.catananti.passwordlab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete result of analysing one password.
 *
 * @param hashes demonstration digests keyed by algorithm, in algorithm order; unavailable backends are absent
 */
public record PasswordAnalysis(
        StrengthResult strength,
        List<CrackTimeEntry> crackTimes,
        List<Suggestion> suggestions,
        Map<HashAlgorithm, String> hashes
) {

    public PasswordAnalysis {
        crackTimes = List.copyOf(crackTimes);
        suggestions = List.copyOf(suggestions);
        hashes = Collections.unmodifiableMap(new LinkedHashMap<>(hashes));
    }
}
