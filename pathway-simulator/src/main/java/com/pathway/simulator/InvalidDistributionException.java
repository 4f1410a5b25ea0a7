package com.pathway.simulator;

import java.util.List;

/**
 * Variable distributions (or the participant count) of a simulation request are invalid. Raised before any
 * participant is simulated.
 */
public class InvalidDistributionException extends RuntimeException {

    private final List<String> errors;

    public InvalidDistributionException(List<String> errors) {
        super("Invalid simulation request: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
