package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.config.ScoringPolicy;
import dev.catananti.passwordlab.exception.InvalidInputException;
import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.PatternScan;
import dev.catananti.passwordlab.model.PatternType;
import dev.catananti.passwordlab.model.StrengthLevel;
import dev.catananti.passwordlab.model.StrengthResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Combines length, character diversity, entropy and best-practice points into a 0-100 score.
 *
 * <p>Components are added first, penalties subtracted afterwards, and only the final value is
 * rounded and clamped. All weights come from {@link ScoringPolicy}.
 */
@Component
@RequiredArgsConstructor
public class StrengthScorer {

    private final ScoringPolicy policy;

    public StrengthResult score(String password, CharacterSetProfile profile, double entropyBits,
                                boolean common, PatternScan scan) {
        if (password == null) {
            throw new InvalidInputException("Password is required");
        }
        int length = password.codePointCount(0, password.length());

        double points = policy.lengthPoints(length)
                + profile.classCount() * policy.diversityPointsPerClass()
                + policy.entropyPoints(entropyBits)
                + bestPracticePoints(length, profile, scan);

        if (common) {
            points -= policy.getCommonPasswordPenalty();
        }
        if (scan.hasPatterns()) {
            points -= policy.getPatternPenalty();
        }

        int score = clamp(Math.round(points));
        return new StrengthResult(score, StrengthLevel.fromScore(score), length, entropyBits,
                profile, common, scan.detected());
    }

    private double bestPracticePoints(int length, CharacterSetProfile profile, PatternScan scan) {
        double points = 0;
        if (length >= policy.getRecommendedLength() && profile.classCount() >= policy.getBestPracticeMinClasses()) {
            points += policy.getCombinedPracticeBonus();
        }
        if (length > 0 && !scan.has(PatternType.REPEAT)) {
            points += policy.getNoRepeatBonus();
        }
        return points;
    }

    private static int clamp(long score) {
        return (int) Math.max(0, Math.min(100, score));
    }
}
