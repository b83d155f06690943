package dev.catananti.passwordlab.exception;

import dev.catananti.passwordlab.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps engine and framework failures onto the {@link ApiResponse} envelope.
 * Exception messages may be message keys; unresolved keys fall back to the raw message.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final List<Locale> SUPPORTED_LOCALES = List.of(Locale.ENGLISH);

    private final MessageSource messageSource;

    @ExceptionHandler(InvalidInputException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleInvalidInput(InvalidInputException ex, ServerWebExchange exchange) {
        log.warn("Invalid input on {}: {}", path(exchange), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, msg(resolveLocale(exchange), ex.getMessage()));
    }

    @ExceptionHandler(InvalidSpecException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleInvalidSpec(InvalidSpecException ex, ServerWebExchange exchange) {
        log.warn("Invalid generation spec on {}: {}", path(exchange), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, msg(resolveLocale(exchange), ex.getMessage()));
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleBackendUnavailable(BackendUnavailableException ex, ServerWebExchange exchange) {
        log.warn("Hash backend unavailable: {}", ex.getAlgorithm());
        Locale locale = resolveLocale(exchange);
        return respond(HttpStatus.SERVICE_UNAVAILABLE,
                msg(locale, "error.backend_unavailable", ex.getAlgorithm().displayName()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldMessage(fieldError, locale))
                .collect(Collectors.joining("; "));
        // field names and constraint messages only, never rejected values
        log.warn("Validation failed on {}: {}", path(exchange), details);
        String message = details.isEmpty() ? msg(locale, "error.invalid_request_data") : details;
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input on {}: {}", path(exchange), ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, msg(resolveLocale(exchange), "error.invalid_request"));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}", path(exchange), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, msg(resolveLocale(exchange), "error.unexpected_error"));
    }

    private Mono<ResponseEntity<ApiResponse<Void>>> respond(HttpStatus status, String message) {
        return Mono.just(ResponseEntity.status(status).body(ApiResponse.error(message)));
    }

    private String fieldMessage(FieldError fieldError, Locale locale) {
        return fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : msg(locale, "error.invalid_value");
    }

    private String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        String acceptLanguage = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            try {
                Locale matched = Locale.lookup(Locale.LanguageRange.parse(acceptLanguage), SUPPORTED_LOCALES);
                if (matched != null) {
                    return matched;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Accept-Language header");
            }
        }
        return Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }
}
