package dev.catananti.passwordlab.controller;

import dev.catananti.passwordlab.dto.AnalysisResponse;
import dev.catananti.passwordlab.dto.ApiResponse;
import dev.catananti.passwordlab.dto.GenerateRequest;
import dev.catananti.passwordlab.dto.GenerationResponse;
import dev.catananti.passwordlab.dto.ImprovementResponse;
import dev.catananti.passwordlab.dto.PasswordRequest;
import dev.catananti.passwordlab.exception.InvalidSpecException;
import dev.catananti.passwordlab.service.PasswordLabService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Password Lab", description = "Strength analysis, generation and improvement")
public class PasswordLabController {

    private final PasswordLabService passwordLabService;

    @PostMapping("/analyze")
    @Operation(summary = "Analyze a password",
            description = "Scores the password, estimates crack times, gives advice and shows demonstration hashes")
    public Mono<ApiResponse<AnalysisResponse>> analyze(@Valid @RequestBody PasswordRequest request) {
        log.debug("Analyze requested");
        return passwordLabService.analyze(request.getPassword())
                .map(AnalysisResponse::from)
                .map(ApiResponse::ok);
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate a password", description = "Creates a random password containing every selected character type")
    public Mono<ApiResponse<GenerationResponse>> generate(@RequestBody(required = false) GenerateRequest request) {
        GenerateRequest effective = request != null ? request : GenerateRequest.builder().build();
        log.debug("Generate requested: length={}", effective.getLength());
        return Mono.fromCallable(effective::toSpec)
                .doOnError(InvalidSpecException.class, passwordLabService::recordInvalidSpec)
                .flatMap(passwordLabService::generate)
                .map(GenerationResponse::from)
                .map(ApiResponse::ok);
    }

    @PostMapping("/improve")
    @Operation(summary = "Suggest stronger variants", description = "Returns up to five variants, best first, none weaker than the input")
    public Mono<ApiResponse<ImprovementResponse>> improve(@Valid @RequestBody PasswordRequest request) {
        log.debug("Improve requested");
        return passwordLabService.improve(request.getPassword())
                .map(candidates -> ImprovementResponse.builder()
                        .original(request.getPassword())
                        .improvements(candidates)
                        .build())
                .map(ApiResponse::ok);
    }
}
