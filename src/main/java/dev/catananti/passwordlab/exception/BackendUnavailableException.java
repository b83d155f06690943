package dev.catananti.passwordlab.exception;

import dev.catananti.passwordlab.model.HashAlgorithm;

/**
 * Thrown when an optional hashing backend is not present in the runtime.
 * Analysis degrades by omitting the affected hash; only direct requests for the backend fail.
 */
public class BackendUnavailableException extends RuntimeException {

    private final HashAlgorithm algorithm;

    public BackendUnavailableException(HashAlgorithm algorithm) {
        super(algorithm.displayName() + " backend is not available");
        this.algorithm = algorithm;
    }

    public HashAlgorithm getAlgorithm() {
        return algorithm;
    }
}
