package dev.catananti.passwordlab.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the analyze and improve endpoints.
 * A missing or empty password is rejected by the engine, so only the upper bound is validated here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PasswordRequest {

    public static final int MAX_PASSWORD_LENGTH = 256;

    @Schema(description = "Password to inspect; never stored or logged", example = "Tr0ub4dor&3")
    @Size(max = MAX_PASSWORD_LENGTH, message = "Password must not exceed 256 characters")
    private String password;
}
