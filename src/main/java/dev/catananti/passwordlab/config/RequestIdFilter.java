package dev.catananti.passwordlab.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Gives every request an id for log correlation.
 * An upstream X-Request-ID is reused when it is well formed, otherwise a fresh one is generated.
 * The id is echoed on the response and put in the Reactor context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String externalRequestId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String sanitized = sanitizeId(externalRequestId);
        if (sanitized == null && externalRequestId != null && !externalRequestId.isBlank()) {
            log.warn("Rejected external request ID");
        }
        String requestId = sanitized != null ? sanitized : newId();

        String correlationHeader = sanitizeId(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        String correlationId = correlationHeader != null ? correlationHeader : requestId;

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .header(REQUEST_ID_HEADER, requestId)
                .header(CORRELATION_ID_HEADER, correlationId)
                .build();
        ServerWebExchange mutatedExchange = exchange.mutate()
                .request(mutatedRequest)
                .build();

        mutatedExchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        mutatedExchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(mutatedExchange)
                .contextWrite(Context.of(
                        REQUEST_ID_CONTEXT_KEY, requestId,
                        "correlationId", correlationId
                ));
    }

    static String sanitizeId(String value) {
        if (value == null || value.isBlank()) return null;
        if (value.length() > MAX_ID_LENGTH) return null;
        if (!VALID_ID_PATTERN.matcher(value).matches()) return null;
        return value;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
