package com.pathway.hierarchy;

import java.util.List;

/**
 * Thrown when an experiment configuration is malformed (bad ordering, quota or pick settings, broken references)
 * or when traversal meets a defect it cannot recover from. Surfaced to the experiment author at publish time.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public ConfigurationException(List<String> errors) {
        super("Invalid experiment configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
