package dev.catananti.passwordlab.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.catananti.passwordlab.model.CharacterSetProfile;
import dev.catananti.passwordlab.model.PatternType;
import dev.catananti.passwordlab.model.StrengthLevel;
import dev.catananti.passwordlab.model.StrengthResult;
import dev.catananti.passwordlab.service.EntropyEstimator;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Strength assessment of one password")
public class StrengthResponse {

    @Schema(description = "Score from 0 to 100", example = "65")
    private int score;

    @Schema(description = "Strength level label", example = "Strong")
    private StrengthLevel level;

    private int length;

    @Schema(description = "Estimated entropy in bits, rounded to 2 decimals", example = "72.1")
    private double entropy;

    private CharacterSetProfile charSets;

    @JsonProperty("isCommon")
    private boolean common;

    private boolean hasPatterns;

    @Schema(description = "Detected pattern kinds", example = "[\"sequence\"]")
    private List<String> patterns;

    public static StrengthResponse from(StrengthResult result) {
        return StrengthResponse.builder()
                .score(result.score())
                .level(result.level())
                .length(result.length())
                .entropy(EntropyEstimator.round2(result.entropyBits()))
                .charSets(result.charSets())
                .common(result.common())
                .hasPatterns(result.hasPatterns())
                .patterns(result.patterns().stream()
                        .sorted()
                        .map(PatternType::name)
                        .map(name -> name.toLowerCase(Locale.ROOT))
                        .toList())
                .build();
    }
}
