package com.sanguo.engine.resolution;

/**
 * Outcome of one resolver step. Failures are ordinary results; faults in
 * the engine itself are thrown instead.
 *
 * @param messageKey localisation key describing a failure; null on success
 */
public record ResolutionResult(boolean success, ResolutionErrorCode errorCode, String messageKey) {
    public static final ResolutionResult SUCCESS = new ResolutionResult(true, null, null);

    public static ResolutionResult failure(ResolutionErrorCode errorCode, String messageKey) {
        if (errorCode == null) {
            throw new IllegalArgumentException("A failure needs an error code");
        }
        return new ResolutionResult(false, errorCode, messageKey);
    }
}
