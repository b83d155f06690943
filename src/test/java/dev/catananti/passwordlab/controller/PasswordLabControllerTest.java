package dev.catananti.passwordlab.controller;

import dev.catananti.passwordlab.exception.GlobalExceptionHandler;
import dev.catananti.passwordlab.metrics.AnalysisMetrics;
import dev.catananti.passwordlab.service.EngineFixtures;
import dev.catananti.passwordlab.service.PasswordAnalyzer;
import dev.catananti.passwordlab.service.PasswordGenerator;
import dev.catananti.passwordlab.service.PasswordLabService;
import dev.catananti.passwordlab.util.DigestUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Standalone WebTestClient over the real engine with cheap hash settings; no Spring context.
 */
@DisplayName("PasswordLabController")
class PasswordLabControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        AnalysisMetrics metrics = new AnalysisMetrics(new SimpleMeterRegistry());
        metrics.init();
        PasswordAnalyzer analyzer = EngineFixtures.analyzer();
        PasswordLabService service = new PasswordLabService(analyzer, new PasswordGenerator(),
                EngineFixtures.improvementGenerator(analyzer), metrics);

        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");

        client = WebTestClient.bindToController(new PasswordLabController(service))
                .controllerAdvice(new GlobalExceptionHandler(messageSource))
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/analyze")
    class Analyze {

        @Test
        @DisplayName("should return the full analysis in the envelope")
        void shouldAnalyze() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("password", "Tr0ub4dor&3"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.error").doesNotExist()
                    .jsonPath("$.data.strength.score").isEqualTo(65)
                    .jsonPath("$.data.strength.level").isEqualTo("Strong")
                    .jsonPath("$.data.strength.entropy").isEqualTo(72.1)
                    .jsonPath("$.data.strength.isCommon").isEqualTo(false)
                    .jsonPath("$.data.strength.charSets.special").isEqualTo(true)
                    .jsonPath("$.data.crackTimes.length()").isEqualTo(5)
                    .jsonPath("$.data.crackTimes[0].algorithm").isEqualTo("plaintext")
                    .jsonPath("$.data.suggestions[0]").isEqualTo("[WARNING] Increase length to at least 12 characters (current: 11)")
                    .jsonPath("$.data.hashes.md5").isEqualTo(DigestUtils.md5Hex("Tr0ub4dor&3"))
                    .jsonPath("$.data.hashes.bcrypt").exists()
                    .jsonPath("$.data.hashes.plaintext").doesNotExist()
                    .jsonPath("$.data.password").doesNotExist();
        }

        @Test
        @DisplayName("should flag a common password")
        void shouldFlagCommonPassword() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("password", "password"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.strength.isCommon").isEqualTo(true)
                    .jsonPath("$.data.strength.level").isEqualTo("Very Weak")
                    .jsonPath("$.data.crackTimes[4].timeHuman").isEqualTo("Instant");
        }

        @Test
        @DisplayName("should reject an empty password with 400")
        void shouldRejectEmptyPassword() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("password", ""))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("Password cannot be empty");
        }

        @Test
        @DisplayName("should reject a missing password with 400")
        void shouldRejectMissingPassword() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Password is required");
        }

        @Test
        @DisplayName("should reject passwords over 256 characters")
        void shouldRejectOversizedPassword() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("password", "x".repeat(257)))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false);
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() {
            client.post().uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"password\":")
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("POST /api/v1/generate")
    class Generate {

        @Test
        @DisplayName("should generate with defaults when no body is sent")
        void shouldGenerateWithDefaults() {
            client.post().uri("/api/v1/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.password").value(password -> assertThat((String) password).hasSize(16))
                    .jsonPath("$.data.strength.length").isEqualTo(16);
        }

        @Test
        @DisplayName("should honour the requested length")
        void shouldHonourLength() {
            client.post().uri("/api/v1/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("length", 24, "includeSpecial", false))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.strength.length").isEqualTo(24)
                    .jsonPath("$.data.strength.charSets.special").isEqualTo(false);
        }

        @Test
        @DisplayName("should reject a length below eight")
        void shouldRejectShortLength() {
            client.post().uri("/api/v1/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("length", 4))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Length must be between 8 and 128 (was 4)");
        }

        @Test
        @DisplayName("should reject a spec with every class disabled")
        void shouldRejectNoClasses() {
            client.post().uri("/api/v1/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("includeLowercase", false, "includeUppercase", false,
                            "includeDigits", false, "includeSpecial", false))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("POST /api/v1/improve")
    class Improve {

        @Test
        @DisplayName("should echo the original and list improvements")
        void shouldImprove() {
            client.post().uri("/api/v1/improve")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("password", "Pass123"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.original").isEqualTo("Pass123")
                    .jsonPath("$.data.improvements").isNotEmpty()
                    .jsonPath("$.data.improvements[0].score").exists()
                    .jsonPath("$.data.improvements[0].strategy").exists();
        }
    }
}
