package dev.catananti.passwordlab.dto;

import dev.catananti.passwordlab.model.GenerationSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

    @Schema(description = "Password length, 8 to 128", example = "16")
    @Builder.Default
    private int length = GenerationSpec.DEFAULT_LENGTH;

    @Builder.Default
    private boolean includeLowercase = true;

    @Builder.Default
    private boolean includeUppercase = true;

    @Builder.Default
    private boolean includeDigits = true;

    @Builder.Default
    private boolean includeSpecial = true;

    /**
     * Range and class checks happen in {@link GenerationSpec} so the engine enforces them for every caller.
     */
    public GenerationSpec toSpec() {
        return new GenerationSpec(length, includeLowercase, includeUppercase, includeDigits, includeSpecial);
    }
}
