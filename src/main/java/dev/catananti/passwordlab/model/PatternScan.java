package dev.catananti.passwordlab.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-code-point pattern classification of a password.
 *
 * @param positions one entry per code point, {@link PatternType#NONE} when the character is unpredictable
 */
public record PatternScan(List<PatternType> positions) {

    public PatternScan {
        positions = List.copyOf(positions);
    }

    public Set<PatternType> detected() {
        Set<PatternType> detected = EnumSet.noneOf(PatternType.class);
        for (PatternType type : positions) {
            if (type != PatternType.NONE) {
                detected.add(type);
            }
        }
        return detected;
    }

    public boolean hasPatterns() {
        return positions.stream().anyMatch(type -> type != PatternType.NONE);
    }

    public boolean has(PatternType type) {
        return positions.contains(type);
    }
}
