package dev.catananti.passwordlab.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.WebFilter;

import java.time.Duration;
import java.time.Instant;

/**
 * Access log for the API. Request and response bodies carry passwords and are never logged.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 1)
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();
            String requestId = exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);

            return chain.filter(exchange)
                    .doOnSuccess(done -> {
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        logRequest(requestId, method, path, status != null ? status.value() : 200,
                                Duration.between(start, Instant.now()));
                    })
                    .doOnError(error -> log.error("[{}] {} {} - ERROR {} in {}ms",
                            requestId, method, path, error.getClass().getSimpleName(),
                            Duration.between(start, Instant.now()).toMillis()));
        };
    }

    static void logRequest(String requestId, String method, String path, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.startsWith("/swagger") || path.startsWith("/v3/api-docs")) {
            log.trace("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else {
            log.info("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        }
    }
}
