package dev.catananti.passwordlab.controller;

import dev.catananti.passwordlab.service.HashDemonstrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API information and lightweight health endpoints.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "API information and version")
@Slf4j
public class ApiInfoController {

    private final HashDemonstrator hashDemonstrator;
    private final String appVersion;

    @Value("${app.name:Password Security Lab API}")
    private String appName;

    @Value("${app.description:Password strength analysis and crack-time estimation}")
    private String appDescription;

    public ApiInfoController(
            HashDemonstrator hashDemonstrator,
            @Autowired(required = false) BuildProperties buildProperties,
            @Value("${app.version:1.0.0}") String fallbackVersion) {
        this.hashDemonstrator = hashDemonstrator;
        if (buildProperties != null) {
            this.appVersion = buildProperties.getVersion();
        } else {
            log.info("BuildProperties not available, using fallback version");
            this.appVersion = fallbackVersion;
        }
    }

    @GetMapping
    @Operation(summary = "API Root", description = "Get API information and available endpoints")
    public Mono<ResponseEntity<Map<String, Object>>> getApiInfo() {
        log.debug("Fetching API info");
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("analyze", "POST /api/v1/analyze");
        endpoints.put("generate", "POST /api/v1/generate");
        endpoints.put("improve", "POST /api/v1/improve");
        endpoints.put("algorithms", "GET /api/v1/algorithms");
        endpoints.put("examples", "GET /api/v1/examples");
        endpoints.put("health", "GET /api/v1/health");
        return Mono.just(ResponseEntity.ok(Map.of(
                "name", appName,
                "description", appDescription,
                "version", appVersion,
                "endpoints", endpoints,
                "documentation", "/swagger-ui.html"
        )));
    }

    @GetMapping("/v1/health")
    @Operation(summary = "Health Check", description = "Service status and Argon2 backend availability")
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        log.debug("Health check requested");
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "healthy",
                "argon2Available", hashDemonstrator.isArgon2Available(),
                "version", appVersion,
                "timestamp", Instant.now().toString()
        )));
    }
}
