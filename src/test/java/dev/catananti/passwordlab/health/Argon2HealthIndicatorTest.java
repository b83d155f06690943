package dev.catananti.passwordlab.health;

import dev.catananti.passwordlab.service.HashDemonstrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Argon2HealthIndicator")
class Argon2HealthIndicatorTest {

    @Mock
    private HashDemonstrator hashDemonstrator;

    @InjectMocks
    private Argon2HealthIndicator indicator;

    @Test
    @DisplayName("should report UP when the backend is available")
    void shouldReportUp() {
        when(hashDemonstrator.isArgon2Available()).thenReturn(true);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("algorithm", "argon2id");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report OUT_OF_SERVICE when the backend is missing")
    void shouldReportOutOfService() {
        when(hashDemonstrator.isArgon2Available()).thenReturn(false);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
                    assertThat(health.getDetails()).containsKey("reason");
                })
                .verifyComplete();
    }
}
