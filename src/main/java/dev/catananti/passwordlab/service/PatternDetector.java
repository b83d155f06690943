package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.model.PatternScan;
import dev.catananti.passwordlab.model.PatternType;
import dev.catananti.passwordlab.util.CharacterClassifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags characters that an attacker could predict from the two characters before them.
 *
 * <p>Assumptions, stated because the rule set is heuristic:
 * <ul>
 *   <li>Only the two preceding code points are considered, so the first two characters of a run
 *       count as random and appending never reclassifies an earlier character.</li>
 *   <li>Matching is case-insensitive.</li>
 *   <li>Sequences must stay inside the ASCII letters or inside the digits; {@code 9ab} is not a run.</li>
 *   <li>Keyboard runs are taken from the three QWERTY letter rows, forwards or backwards. The digit
 *       row is already covered by sequences.</li>
 *   <li>When a triple matches more than one rule the first of REPEAT, SEQUENCE, KEYBOARD wins.</li>
 * </ul>
 */
@Component
public class PatternDetector {

    private static final List<String> KEYBOARD_ROWS = List.of("qwertyuiop", "asdfghjkl", "zxcvbnm");

    public PatternScan scan(String password) {
        int[] cps = password.toLowerCase(Locale.ROOT).codePoints().toArray();
        List<PatternType> positions = new ArrayList<>(cps.length);
        for (int i = 0; i < cps.length; i++) {
            positions.add(i < 2 ? PatternType.NONE : classify(cps[i - 2], cps[i - 1], cps[i]));
        }
        return new PatternScan(positions);
    }

    private PatternType classify(int a, int b, int c) {
        if (a == b && b == c) {
            return PatternType.REPEAT;
        }
        if (isSequence(a, b, c)) {
            return PatternType.SEQUENCE;
        }
        if (isKeyboardRun(a, b, c)) {
            return PatternType.KEYBOARD;
        }
        return PatternType.NONE;
    }

    private boolean isSequence(int a, int b, int c) {
        int step = b - a;
        if ((step != 1 && step != -1) || c - b != step) {
            return false;
        }
        boolean letters = CharacterClassifier.isAsciiLetter(a) && CharacterClassifier.isAsciiLetter(c);
        boolean digits = CharacterClassifier.isDigit(a) && CharacterClassifier.isDigit(c);
        return letters || digits;
    }

    private boolean isKeyboardRun(int a, int b, int c) {
        if (!CharacterClassifier.isAsciiLetter(a) || !CharacterClassifier.isAsciiLetter(b)
                || !CharacterClassifier.isAsciiLetter(c)) {
            return false;
        }
        String forward = new String(new int[]{a, b, c}, 0, 3);
        String backward = new String(new int[]{c, b, a}, 0, 3);
        for (String row : KEYBOARD_ROWS) {
            if (row.contains(forward) || row.contains(backward)) {
                return true;
            }
        }
        return false;
    }
}
