package dev.catananti.passwordlab.util;

import dev.catananti.passwordlab.model.CharacterSetProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CharacterClassifier")
class CharacterClassifierTest {

    @Nested
    @DisplayName("classify()")
    class Classify {

        @Test
        @DisplayName("should detect every class in a mixed password")
        void shouldDetectAllClasses() {
            CharacterSetProfile profile = CharacterClassifier.classify("Tr0ub4dor&3");

            assertThat(profile).isEqualTo(new CharacterSetProfile(true, true, true, true));
            assertThat(profile.classCount()).isEqualTo(4);
            assertThat(profile.alphabetSize()).isEqualTo(94);
        }

        @Test
        @DisplayName("should return the empty profile for empty input")
        void shouldReturnEmptyProfile() {
            assertThat(CharacterClassifier.classify("")).isEqualTo(CharacterSetProfile.EMPTY);
            assertThat(CharacterClassifier.classify(null)).isEqualTo(CharacterSetProfile.EMPTY);
            assertThat(CharacterSetProfile.EMPTY.alphabetSize()).isZero();
        }

        @Test
        @DisplayName("should count only the classes present")
        void shouldCountOnlyPresentClasses() {
            CharacterSetProfile profile = CharacterClassifier.classify("password");

            assertThat(profile.lowercase()).isTrue();
            assertThat(profile.uppercase()).isFalse();
            assertThat(profile.digits()).isFalse();
            assertThat(profile.special()).isFalse();
            assertThat(profile.alphabetSize()).isEqualTo(26);
        }

        @Test
        @DisplayName("should treat spaces and non-ASCII symbols as special")
        void shouldTreatNonAlphanumericAsSpecial() {
            assertThat(CharacterClassifier.classify("hello world").special()).isTrue();
            assertThat(CharacterClassifier.classify("café").special()).isTrue();
            assertThat(CharacterClassifier.classify("🔒").special()).isTrue();
        }

        @Test
        @DisplayName("should not count non-ASCII letters as lowercase or uppercase")
        void shouldKeepLettersAscii() {
            CharacterSetProfile profile = CharacterClassifier.classify("Éé");

            assertThat(profile.lowercase()).isFalse();
            assertThat(profile.uppercase()).isFalse();
            assertThat(profile.special()).isTrue();
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {'\n', '\t', 0x7f})
    @DisplayName("control characters belong to no class")
    void controlCharactersBelongToNoClass(int codePoint) {
        assertThat(CharacterClassifier.isSpecial(codePoint)).isFalse();
        assertThat(CharacterClassifier.isAsciiLetter(codePoint)).isFalse();
        assertThat(CharacterClassifier.isDigit(codePoint)).isFalse();
    }
}
