package dev.catananti.passwordlab.config;

import dev.catananti.passwordlab.model.HashAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AttackSpeedPolicy")
class AttackSpeedPolicyTest {

    @Test
    @DisplayName("should expose the default speeds per algorithm")
    void shouldExposeDefaults() {
        AttackSpeedPolicy policy = AttackSpeedPolicy.defaults();

        assertThat(policy.speedOf(HashAlgorithm.PLAIN_TEXT)).isEqualTo(1e15);
        assertThat(policy.speedOf(HashAlgorithm.MD5)).isEqualTo(1.8e11);
        assertThat(policy.speedOf(HashAlgorithm.SHA256)).isEqualTo(6.5e10);
        assertThat(policy.speedOf(HashAlgorithm.BCRYPT)).isEqualTo(8.5e4);
        assertThat(policy.speedOf(HashAlgorithm.ARGON2)).isEqualTo(1e3);
    }

    @Test
    @DisplayName("should fail fast when speeds are not strictly decreasing")
    void shouldRejectNonDecreasingSpeeds() {
        assertThatThrownBy(() -> new AttackSpeedPolicy(1e15, 1.8e11, 1.8e11, 8.5e4, 1e3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("strictly decrease");
    }

    @Test
    @DisplayName("should fail fast on non-positive or infinite speeds")
    void shouldRejectInvalidSpeeds() {
        assertThatThrownBy(() -> new AttackSpeedPolicy(1e15, 1.8e11, 6.5e10, 8.5e4, 0))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new AttackSpeedPolicy(Double.POSITIVE_INFINITY, 1.8e11, 6.5e10, 8.5e4, 1e3))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new AttackSpeedPolicy(1e15, 1.8e11, Double.NaN, 8.5e4, 1e3))
                .isInstanceOf(IllegalStateException.class);
    }
}
