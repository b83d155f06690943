package dev.catananti.passwordlab.dto;

import dev.catananti.passwordlab.model.GeneratedPassword;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResponse {

    private String password;
    private StrengthResponse strength;

    public static GenerationResponse from(GeneratedPassword generated) {
        return GenerationResponse.builder()
                .password(generated.password())
                .strength(StrengthResponse.from(generated.strength()))
                .build();
    }
}
