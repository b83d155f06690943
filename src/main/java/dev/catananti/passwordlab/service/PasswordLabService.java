package dev.catananti.passwordlab.service;

import dev.catananti.passwordlab.exception.InvalidInputException;
import dev.catananti.passwordlab.exception.InvalidSpecException;
import dev.catananti.passwordlab.metrics.AnalysisMetrics;
import dev.catananti.passwordlab.model.GeneratedPassword;
import dev.catananti.passwordlab.model.GenerationSpec;
import dev.catananti.passwordlab.model.ImprovementCandidate;
import dev.catananti.passwordlab.model.PasswordAnalysis;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Reactive facade over the analysis engine.
 * Work is CPU-bound (bcrypt/Argon2), so it runs on boundedElastic rather than the Netty event loop.
 * Passwords are never logged; only lengths, levels and counts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordLabService {

    private final PasswordAnalyzer analyzer;
    private final PasswordGenerator generator;
    private final ImprovementGenerator improvementGenerator;
    private final AnalysisMetrics metrics;

    public Mono<PasswordAnalysis> analyze(String password) {
        return Mono.fromCallable(() -> {
                    Timer.Sample sample = metrics.startAnalysis();
                    try {
                        return analyzer.analyze(password);
                    } finally {
                        metrics.stopAnalysis(sample);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(analysis -> {
                    metrics.recordAnalysis(analysis.strength().level());
                    log.debug("Analyzed password: length={}, score={}, level={}",
                            analysis.strength().length(), analysis.strength().score(), analysis.strength().level());
                })
                .doOnError(InvalidInputException.class, e -> metrics.recordRejection("invalid_input"));
    }

    public Mono<GeneratedPassword> generate(GenerationSpec spec) {
        return Mono.fromCallable(() -> {
                    String password = generator.generate(spec);
                    return new GeneratedPassword(password, analyzer.assess(password));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(generated -> {
                    metrics.recordGeneration();
                    log.debug("Generated password: length={}, level={}", spec.length(), generated.strength().level());
                });
    }

    public Mono<List<ImprovementCandidate>> improve(String password) {
        return Mono.fromCallable(() -> improvementGenerator.improve(password))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(candidates -> {
                    metrics.recordImprovement();
                    log.debug("Produced {} improvement candidates", candidates.size());
                })
                .doOnError(InvalidInputException.class, e -> metrics.recordRejection("invalid_input"));
    }

    public void recordInvalidSpec(InvalidSpecException e) {
        log.debug("Rejected generation spec: {}", e.getMessage());
        metrics.recordRejection("invalid_spec");
    }
}
