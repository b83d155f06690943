package dev.catananti.passwordlab.dto;

import dev.catananti.passwordlab.model.CrackTimeEntry;
import dev.catananti.passwordlab.model.HashAlgorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrackTimeResponse {

    private HashAlgorithm algorithm;
    private String name;
    private double attackSpeed;
    private double timeSeconds;
    private String timeHuman;

    public static CrackTimeResponse from(CrackTimeEntry entry) {
        return CrackTimeResponse.builder()
                .algorithm(entry.algorithm())
                .name(entry.algorithm().displayName())
                .attackSpeed(entry.attackSpeedHashesPerSecond())
                .timeSeconds(entry.timeSeconds())
                .timeHuman(entry.timeHuman())
                .build();
    }
}
