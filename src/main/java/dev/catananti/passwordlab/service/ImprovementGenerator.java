package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.config.ScoringPolicy;
import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.ImprovementCandidate;
import dev.catananti.passwordlab.model.ImprovementStrategy;
import dev.catananti.passwordlab.model.PatternScan;
import dev.catananti.passwordlab.model.PatternType;
import dev.catananti.passwordlab.model.StrengthResult;
import dev.catananti.passwordlab.util.CharacterClassifier;
import dev.catananti.passwordlab.util.CharacterPools;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suggests stronger variants of a password.
 *
 * <p>Every variant is re-scored through {@link PasswordAnalyzer#assess(String)}; a variant scoring
 * below the original is discarded. Duplicates keep their first occurrence and the result is ordered
 * best first.
 */
@Component
@Slf4j
public class ImprovementGenerator {

    public static final int MAX_CANDIDATES = 5;
    static final int EXTRA_LENGTH = 4;
    private static final int MAX_PICK_ATTEMPTS = 16;

    private static final Map<Character, Character> LEET = leetTable();
    private static final List<String> PASSPHRASE_WORDS = List.of("Secure", "Strong", "Private", "Safe");
    private static final String RUN_BREAKERS = CharacterPools.DIGITS + CharacterPools.SPECIAL;

    private final PasswordAnalyzer analyzer;
    private final PatternDetector patternDetector;
    private final int targetLength;
    private final SecureRandom random;

    @Autowired
    public ImprovementGenerator(PasswordAnalyzer analyzer, PatternDetector patternDetector, ScoringPolicy policy) {
        this(analyzer, patternDetector, policy, new SecureRandom());
    }

    ImprovementGenerator(PasswordAnalyzer analyzer, PatternDetector patternDetector, ScoringPolicy policy,
                         SecureRandom random) {
        this.analyzer = analyzer;
        this.patternDetector = patternDetector;
        this.targetLength = policy.getLengthTiers().lastKey();
        this.random = random;
    }

    public List<ImprovementCandidate> improve(String original) {
        PasswordAnalyzer.requirePassword(original);
        StrengthResult baseline = analyzer.assess(original);
        CharacterSetProfile profile = baseline.charSets();

        Map<String, Draft> drafts = new LinkedHashMap<>();
        String withClasses = appendMissingClasses(original, profile);
        offer(drafts, original, new Draft(withClasses, ImprovementStrategy.ADD_MISSING_CLASSES,
                "Appended " + missingClassNames(profile)));

        String extended = extend(original);
        offer(drafts, original, new Draft(extended, ImprovementStrategy.EXTEND_LENGTH,
                "Extended to " + length(extended) + " characters"));

        String substituted = substitute(original);
        offer(drafts, original, new Draft(substituted, ImprovementStrategy.SUBSTITUTE,
                "Replaced letters and predictable runs with numbers and symbols"));

        String combined = extend(substituted);
        combined = appendMissingClasses(combined, CharacterClassifier.classify(combined));
        offer(drafts, original, new Draft(combined, ImprovementStrategy.COMBINED,
                "Substituted characters and extended to " + length(combined) + " characters"));

        if (length(original) > 3) {
            String passphrase = PASSPHRASE_WORDS.get(random.nextInt(PASSPHRASE_WORDS.size()))
                    + "-" + original + "-" + (100 + random.nextInt(900)) + "!";
            offer(drafts, original, new Draft(passphrase, ImprovementStrategy.PASSPHRASE,
                    "Created a memorable passphrase around the original"));
        }

        List<ImprovementCandidate> candidates = new ArrayList<>(drafts.size());
        for (Draft draft : drafts.values()) {
            StrengthResult rescored = analyzer.assess(draft.password());
            if (rescored.score() >= baseline.score()) {
                candidates.add(new ImprovementCandidate(draft.password(), rescored.score(), rescored.level(),
                        rescored.length(), draft.strategy(), draft.description()));
            }
        }
        candidates.sort(Comparator.comparingInt(ImprovementCandidate::score).reversed());
        log.debug("Generated {} improvement candidates (baseline score {})", candidates.size(), baseline.score());
        return List.copyOf(candidates.subList(0, Math.min(MAX_CANDIDATES, candidates.size())));
    }

    private static void offer(Map<String, Draft> drafts, String original, Draft draft) {
        if (!draft.password().equals(original)) {
            drafts.putIfAbsent(draft.password(), draft);
        }
    }

    private String appendMissingClasses(String password, CharacterSetProfile profile) {
        StringBuilder sb = new StringBuilder(password);
        if (!profile.lowercase()) sb.append(CharacterPools.pick(CharacterPools.LOWERCASE, random));
        if (!profile.uppercase()) sb.append(CharacterPools.pick(CharacterPools.UPPERCASE, random));
        if (!profile.digits()) sb.append(CharacterPools.pick(CharacterPools.DIGITS, random));
        if (!profile.special()) sb.append(CharacterPools.pick(CharacterPools.SPECIAL, random));
        return sb.toString();
    }

    /**
     * Pads to the target length, or by {@link #EXTRA_LENGTH} characters when the password already
     * reaches it. Appended characters never start a repeat, sequence or keyboard run.
     */
    private String extend(String password) {
        int current = length(password);
        int target = current < targetLength ? targetLength : current + EXTRA_LENGTH;
        StringBuilder sb = new StringBuilder(password);
        for (int i = current; i < target; i++) {
            appendOutsideRuns(sb);
        }
        return sb.toString();
    }

    private void appendOutsideRuns(StringBuilder sb) {
        int end = sb.length();
        for (int attempt = 0; attempt < MAX_PICK_ATTEMPTS; attempt++) {
            sb.setLength(end);
            sb.append(CharacterPools.pick(CharacterPools.ALL, random));
            List<PatternType> positions = patternDetector.scan(sb.toString()).positions();
            if (positions.get(positions.size() - 1) == PatternType.NONE) {
                return;
            }
        }
    }

    /**
     * Breaks predictable runs, applies leetspeak to the first occurrence of each mapped letter and
     * capitalises the first letter when there is no uppercase.
     */
    private String substitute(String password) {
        int[] cps = password.codePoints().toArray();
        PatternScan scan = patternDetector.scan(password);
        for (int i = 0; i < cps.length; i++) {
            if (scan.positions().get(i) != PatternType.NONE) {
                cps[i] = CharacterPools.pick(RUN_BREAKERS, random);
            }
        }
        for (Map.Entry<Character, Character> leet : LEET.entrySet()) {
            for (int i = 0; i < cps.length; i++) {
                if (cps[i] == leet.getKey()) {
                    cps[i] = leet.getValue();
                    break;
                }
            }
        }
        boolean hasUpper = false;
        for (int cp : cps) {
            hasUpper |= CharacterClassifier.isUppercase(cp);
        }
        if (!hasUpper) {
            for (int i = 0; i < cps.length; i++) {
                if (CharacterClassifier.isLowercase(cps[i])) {
                    cps[i] = Character.toUpperCase(cps[i]);
                    break;
                }
            }
        }
        return new String(cps, 0, cps.length);
    }

    private static String missingClassNames(CharacterSetProfile profile) {
        List<String> names = new ArrayList<>(4);
        if (!profile.lowercase()) names.add("lowercase");
        if (!profile.uppercase()) names.add("uppercase");
        if (!profile.digits()) names.add("digit");
        if (!profile.special()) names.add("special");
        return String.join(", ", names) + " characters";
    }

    private static int length(String password) {
        return password.codePointCount(0, password.length());
    }

    private static Map<Character, Character> leetTable() {
        Map<Character, Character> table = new LinkedHashMap<>();
        table.put('a', '@');
        table.put('e', '3');
        table.put('i', '!');
        table.put('o', '0');
        table.put('s', '$');
        table.put('t', '7');
        table.put('l', '1');
        return table;
    }

    private record Draft(String password, ImprovementStrategy strategy, String description) {
    }
}
