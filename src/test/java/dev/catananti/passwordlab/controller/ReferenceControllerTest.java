package dev.catananti.passwordlab.controller;

import dev.catananti.passwordlab.service.EngineFixtures;
import dev.catananti.passwordlab.service.ReferenceDataService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

@DisplayName("ReferenceController")
class ReferenceControllerTest {

    private final WebTestClient client = WebTestClient
            .bindToController(new ReferenceController(new ReferenceDataService(EngineFixtures.fastHashesWithoutArgon2())))
            .build();

    @Test
    @DisplayName("GET /api/v1/algorithms should list five algorithms with Argon2 availability")
    void shouldListAlgorithms() {
        client.get().uri("/api/v1/algorithms")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.length()").isEqualTo(5)
                .jsonPath("$.data[0].algorithm").isEqualTo("plaintext")
                .jsonPath("$.data[0].status").isEqualTo("insecure")
                .jsonPath("$.data[0].available").doesNotExist()
                .jsonPath("$.data[4].name").isEqualTo("Argon2")
                .jsonPath("$.data[4].available").isEqualTo(false);
    }

    @Test
    @DisplayName("GET /api/v1/examples should list the quick-test passwords")
    void shouldListExamples() {
        client.get().uri("/api/v1/examples")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(5)
                .jsonPath("$.data[0].password").isEqualTo("password")
                .jsonPath("$.data[0].expectedScore").isEqualTo(0)
                .jsonPath("$.data[4].expectedScore").isEqualTo(93);
    }
}
