package dev.catananti.passwordlab.metrics;

import dev.catananti.passwordlab.model.StrengthLevel;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnalysisMetrics")
class AnalysisMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private AnalysisMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AnalysisMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        @DisplayName("should register the fixed meters")
        void shouldRegisterMeters() {
            metrics.init();

            assertThat(meterRegistry.find("password_lab.generations").counter()).isNotNull();
            assertThat(meterRegistry.find("password_lab.improvements").counter()).isNotNull();
            assertThat(meterRegistry.find("password_lab.analysis.duration").timer()).isNotNull();
        }
    }

    @Nested
    @DisplayName("recording")
    class Recording {

        @BeforeEach
        void init() {
            metrics.init();
        }

        @Test
        @DisplayName("should tag analyses by level")
        void shouldTagAnalysesByLevel() {
            metrics.recordAnalysis(StrengthLevel.STRONG);
            metrics.recordAnalysis(StrengthLevel.STRONG);
            metrics.recordAnalysis(StrengthLevel.VERY_WEAK);

            assertThat(meterRegistry.get("password_lab.analyses").tag("level", "strong").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("password_lab.analyses").tag("level", "very_weak").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should count generations, improvements and rejections")
        void shouldCountEvents() {
            metrics.recordGeneration();
            metrics.recordImprovement();
            metrics.recordRejection("invalid_spec");

            assertThat(meterRegistry.get("password_lab.generations").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("password_lab.improvements").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("password_lab.rejections").tag("reason", "invalid_spec").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should time an analysis")
        void shouldTimeAnalysis() {
            Timer.Sample sample = metrics.startAnalysis();
            metrics.stopAnalysis(sample);

            assertThat(meterRegistry.get("password_lab.analysis.duration").timer().count()).isEqualTo(1);
        }
    }
}
