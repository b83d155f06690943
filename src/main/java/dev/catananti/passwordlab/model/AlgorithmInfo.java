package dev.catananti.passwordlab.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Static reference card for one storage scheme.
 *
 * @param available only set for schemes backed by an optional library
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlgorithmInfo(
        HashAlgorithm algorithm,
        String name,
        String status,
        String speed,
        String description,
        String useCase,
        String year,
        Boolean available
) {

    public AlgorithmInfo withAvailability(boolean isAvailable) {
        return new AlgorithmInfo(algorithm, name, status, speed, description, useCase, year, isAvailable);
    }
}
