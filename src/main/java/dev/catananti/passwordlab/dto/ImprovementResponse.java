package dev.catananti.passwordlab.dto;

import dev.catananti.passwordlab.model.ImprovementCandidate;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stronger variants of a password, best first")
public class ImprovementResponse {

    private String original;

    @Schema(description = "At most five candidates, none scoring below the original")
    private List<ImprovementCandidate> improvements;
}
