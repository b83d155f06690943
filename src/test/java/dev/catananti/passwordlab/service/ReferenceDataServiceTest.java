package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.model.AlgorithmInfo;
import dev.catananti.passwordlab.model.HashAlgorithm;
import dev.catananti.passwordlab.model.PasswordExample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReferenceDataService")
class ReferenceDataServiceTest {

    @Test
    @DisplayName("should list all algorithms in order with Argon2 availability")
    void shouldListAlgorithms() {
        List<AlgorithmInfo> algorithms = new ReferenceDataService(EngineFixtures.fastHashes()).algorithms();

        assertThat(algorithms).extracting(AlgorithmInfo::algorithm).containsExactly(HashAlgorithm.values());
        assertThat(algorithms.get(4).available()).isTrue();
        assertThat(algorithms.subList(0, 4)).allSatisfy(info -> assertThat(info.available()).isNull());
    }

    @Test
    @DisplayName("should report Argon2 as unavailable when the backend is missing")
    void shouldReportMissingArgon2() {
        List<AlgorithmInfo> algorithms = new ReferenceDataService(EngineFixtures.fastHashesWithoutArgon2()).algorithms();

        assertThat(algorithms.get(4).available()).isFalse();
    }

    @Test
    @DisplayName("example scores should match what the analyzer computes")
    void examplesShouldMatchAnalyzer() {
        PasswordAnalyzer analyzer = EngineFixtures.analyzer();

        for (PasswordExample example : new ReferenceDataService(EngineFixtures.fastHashes()).examples()) {
            assertThat(analyzer.assess(example.password()).score())
                    .as(example.password())
                    .isEqualTo(example.expectedScore());
        }
    }
}
