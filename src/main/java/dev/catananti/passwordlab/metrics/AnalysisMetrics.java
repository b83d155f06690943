package dev.catananti.passwordlab.metrics;

import dev.catananti.passwordlab.model.StrengthLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Usage counters for the lab. Never tagged with anything derived from a password beyond its level.
 */
@Component
@RequiredArgsConstructor
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;

    private Counter generationCounter;
    private Counter improvementCounter;
    private Timer analysisTimer;

    @PostConstruct
    public void init() {
        generationCounter = Counter.builder("password_lab.generations")
                .description("Number of generated passwords")
                .register(meterRegistry);
        improvementCounter = Counter.builder("password_lab.improvements")
                .description("Number of improvement requests")
                .register(meterRegistry);
        analysisTimer = Timer.builder("password_lab.analysis.duration")
                .description("Full analysis time including demonstration hashing")
                .register(meterRegistry);
    }

    public void recordAnalysis(StrengthLevel level) {
        meterRegistry.counter("password_lab.analyses", "level", level.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordGeneration() {
        generationCounter.increment();
    }

    public void recordImprovement() {
        improvementCounter.increment();
    }

    public void recordRejection(String reason) {
        meterRegistry.counter("password_lab.rejections", "reason", reason).increment();
    }

    public Timer.Sample startAnalysis() {
        return Timer.start(meterRegistry);
    }

    public void stopAnalysis(Timer.Sample sample) {
        sample.stop(analysisTimer);
    }
}
