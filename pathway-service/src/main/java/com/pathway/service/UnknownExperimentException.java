package com.pathway.service;

/**
 * Thrown when an operation names an experiment that was never published (or was closed).
 */
public class UnknownExperimentException extends RuntimeException {

    private final String experimentId;

    public UnknownExperimentException(String experimentId) {
        super("Unknown experiment: " + experimentId);
        this.experimentId = experimentId;
    }

    public String getExperimentId() {
        return experimentId;
    }
}
