package dev.catananti.passwordlab.health;

import dev.catananti.passwordlab.service.HashDemonstrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports whether the Argon2 backend can be used.
 * A missing backend is OUT_OF_SERVICE rather than DOWN: analysis still works, it only omits Argon2 hashes.
 */
@Component("argon2")
@RequiredArgsConstructor
@Slf4j
public class Argon2HealthIndicator implements ReactiveHealthIndicator {

    private final HashDemonstrator hashDemonstrator;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            if (hashDemonstrator.isArgon2Available()) {
                return Health.up()
                        .withDetail("algorithm", "argon2id")
                        .build();
            }
            log.debug("Argon2 health check: backend not available");
            return Health.outOfService()
                    .withDetail("algorithm", "argon2id")
                    .withDetail("reason", "Argon2 backend library not on classpath")
                    .build();
        });
    }
}
