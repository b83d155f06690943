package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.exception.InvalidInputException;
import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.CrackTimeEntry;
import dev.catananti.passwordlab.model.HashAlgorithm;
import dev.catananti.passwordlab.model.PasswordAnalysis;
import dev.catananti.passwordlab.model.PatternScan;
import dev.catananti.passwordlab.model.StrengthResult;
import dev.catananti.passwordlab.model.Suggestion;
import dev.catananti.passwordlab.util.CharacterClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Synchronous analysis pipeline: classify, scan patterns, estimate entropy, check the dictionary,
 * score, then derive crack times, suggestions and demonstration hashes.
 * Holds no state between calls.
 */
@Service
@RequiredArgsConstructor
public class PasswordAnalyzer {

    private final PatternDetector patternDetector;
    private final EntropyEstimator entropyEstimator;
    private final CommonPasswordDictionary dictionary;
    private final StrengthScorer scorer;
    private final CrackTimeEstimator crackTimeEstimator;
    private final SuggestionEngine suggestionEngine;
    private final HashDemonstrator hashDemonstrator;

    /**
     * Strength only; no hashing.
     */
    public StrengthResult assess(String password) {
        requirePassword(password);
        CharacterSetProfile profile = CharacterClassifier.classify(password);
        PatternScan scan = patternDetector.scan(password);
        double entropyBits = entropyEstimator.estimate(profile, scan);
        boolean common = dictionary.isCommon(password);
        return scorer.score(password, profile, entropyBits, common, scan);
    }

    public PasswordAnalysis analyze(String password) {
        StrengthResult strength = assess(password);
        List<CrackTimeEntry> crackTimes = crackTimeEstimator.estimate(strength.entropyBits(), strength.common());
        List<Suggestion> suggestions = suggestionEngine.suggest(strength);
        Map<HashAlgorithm, String> hashes = hashDemonstrator.demonstrate(password);
        return new PasswordAnalysis(strength, crackTimes, suggestions, hashes);
    }

    static void requirePassword(String password) {
        if (password == null) {
            throw new InvalidInputException("Password is required");
        }
        if (password.isEmpty()) {
            throw new InvalidInputException("Password cannot be empty");
        }
    }
}
