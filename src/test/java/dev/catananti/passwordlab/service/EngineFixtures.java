package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.config.AttackSpeedPolicy;
import dev.catananti.passwordlab.config.ScoringPolicy;

/**
 * Container-free wiring of the analysis engine with cheap hash settings.
 */
public final class EngineFixtures {

    private EngineFixtures() {
    }

    public static HashDemonstrator fastHashes() {
        return new HashDemonstrator(4, 1024, 1, true);
    }

    public static HashDemonstrator fastHashesWithoutArgon2() {
        return new HashDemonstrator(4, 1024, 1, false);
    }

    public static PasswordAnalyzer analyzer() {
        return analyzer(fastHashes());
    }

    public static PasswordAnalyzer analyzer(HashDemonstrator hashes) {
        ScoringPolicy policy = ScoringPolicy.defaults();
        PatternDetector detector = new PatternDetector();
        return new PasswordAnalyzer(
                detector,
                new EntropyEstimator(detector),
                CommonPasswordDictionary.fromClasspath(),
                new StrengthScorer(policy),
                new CrackTimeEstimator(AttackSpeedPolicy.defaults()),
                new SuggestionEngine(policy),
                hashes);
    }

    public static ImprovementGenerator improvementGenerator(PasswordAnalyzer analyzer) {
        return new ImprovementGenerator(analyzer, new PatternDetector(), ScoringPolicy.defaults());
    }
}
