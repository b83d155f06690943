package dev.catananti.passwordlab.controller;

import dev.catananti.passwordlab.dto.ApiResponse;
import dev.catananti.passwordlab.model.AlgorithmInfo;
import dev.catananti.passwordlab.model.PasswordExample;
import dev.catananti.passwordlab.service.ReferenceDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Reference", description = "Hash algorithm cards and example passwords")
public class ReferenceController {

    private final ReferenceDataService referenceDataService;

    @GetMapping("/algorithms")
    @Operation(summary = "List storage algorithms", description = "Static comparison data; the Argon2 entry reports backend availability")
    public Mono<ApiResponse<List<AlgorithmInfo>>> algorithms() {
        return Mono.fromSupplier(referenceDataService::algorithms)
                .map(ApiResponse::ok);
    }

    @GetMapping("/examples")
    @Operation(summary = "List example passwords", description = "Quick-test passwords with their expected scores")
    public Mono<ApiResponse<List<PasswordExample>>> examples() {
        return Mono.just(ApiResponse.ok(referenceDataService.examples()));
    }
}
