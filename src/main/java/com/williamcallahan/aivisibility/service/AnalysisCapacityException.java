package com.williamcallahan.aivisibility.service;

/**
 * Thrown when the orchestration executor cannot accept another session.
 */
public class AnalysisCapacityException extends RuntimeException {

    /**
     * Creates the exception.
     *
     * @param message description of the saturation
     * @param cause executor rejection
     */
    public AnalysisCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
