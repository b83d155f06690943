package dev.catananti.passwordlab.dto;

import dev.catananti.passwordlab.model.PasswordAnalysis;
import dev.catananti.passwordlab.model.Suggestion;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full analysis payload. The submitted password is deliberately not part of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Strength, crack times, suggestions and demonstration hashes")
public class AnalysisResponse {

    private StrengthResponse strength;

    private List<CrackTimeResponse> crackTimes;

    @Schema(description = "Ordered advice, each prefixed with a severity marker",
            example = "[\"[WARNING] Add special characters (!@#$%^&*)\"]")
    private List<String> suggestions;

    @Schema(description = "Demonstration digests keyed by algorithm; argon2 is absent when unavailable")
    private Map<String, String> hashes;

    public static AnalysisResponse from(PasswordAnalysis analysis) {
        Map<String, String> hashes = new LinkedHashMap<>();
        analysis.hashes().forEach((algorithm, digest) -> hashes.put(algorithm.key(), digest));
        return AnalysisResponse.builder()
                .strength(StrengthResponse.from(analysis.strength()))
                .crackTimes(analysis.crackTimes().stream().map(CrackTimeResponse::from).toList())
                .suggestions(analysis.suggestions().stream().map(Suggestion::text).toList())
                .hashes(hashes)
                .build();
    }
}
