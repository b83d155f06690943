package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.config.ScoringPolicy;
import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.PatternType;
import dev.catananti.passwordlab.model.StrengthLevel;
import dev.catananti.passwordlab.model.StrengthResult;
import dev.catananti.passwordlab.model.Suggestion;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based advice derived from a strength result.
 * Every rule is evaluated; the acknowledgment only appears when no other rule fired.
 */
@Component
@RequiredArgsConstructor
public class SuggestionEngine {

    static final int DICTIONARY_WORD_MIN_LENGTH = 4;

    private final ScoringPolicy policy;

    public List<Suggestion> suggest(StrengthResult result) {
        List<Suggestion> suggestions = new ArrayList<>();
        CharacterSetProfile charSets = result.charSets();

        if (result.common()) {
            suggestions.add(Suggestion.critical("This is a commonly used password! Change it immediately."));
        }

        if (!charSets.uppercase()) {
            suggestions.add(Suggestion.warning("Add uppercase letters (A-Z)"));
        }
        if (!charSets.lowercase()) {
            suggestions.add(Suggestion.warning("Add lowercase letters (a-z)"));
        }
        if (!charSets.digits()) {
            suggestions.add(Suggestion.warning("Add numbers (0-9)"));
        }
        if (!charSets.special()) {
            suggestions.add(Suggestion.warning("Add special characters (!@#$%^&*)"));
        }

        int recommended = policy.getRecommendedLength();
        int strong = policy.getLengthTiers().lastKey();
        if (result.length() < recommended) {
            suggestions.add(Suggestion.warning(
                    "Increase length to at least " + recommended + " characters (current: " + result.length() + ")"));
        } else if (result.length() < strong) {
            suggestions.add(Suggestion.tip(
                    "Consider " + strong + "+ characters for better security (current: " + result.length() + ")"));
        }

        if (result.hasPatterns()) {
            suggestions.add(Suggestion.warning("Avoid predictable patterns (abc, 123, aaa, keyboard runs like qwe)"));
        }
        if (result.patterns().contains(PatternType.REPEAT)) {
            suggestions.add(Suggestion.warning("Avoid repeating the same character three or more times in a row"));
        }
        if (isLettersOnly(charSets) && result.length() >= DICTIONARY_WORD_MIN_LENGTH) {
            suggestions.add(Suggestion.warning("Avoid single dictionary words - use a passphrase or random characters"));
        }

        if (!suggestions.isEmpty()) {
            suggestions.add(Suggestion.tip("Use a passphrase (e.g. 'Correct-Horse-Battery-Staple-2024!')"));
            suggestions.add(Suggestion.tip("Use a password manager to generate and store strong passwords"));
            suggestions.add(Suggestion.tip("Never reuse passwords across different accounts"));
        } else if (result.level() == StrengthLevel.VERY_STRONG) {
            suggestions.add(Suggestion.neutral("Excellent password! Maintain this security level for all accounts."));
        }
        return List.copyOf(suggestions);
    }

    private static boolean isLettersOnly(CharacterSetProfile charSets) {
        return (charSets.lowercase() || charSets.uppercase()) && !charSets.digits() && !charSets.special();
    }
}
