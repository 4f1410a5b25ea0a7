package com.pathway.hierarchy.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of publish-time validation of an experiment. Errors block publishing; warnings are reported
 * to the author but the runtime tolerates them (e.g. an unknown ordering mode falls back to sequential).
 */
public final class ValidationResult {

    private final List<String> errors;
    private final List<String> warnings;

    private ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.warnings = warnings != null ? Collections.unmodifiableList(new ArrayList<>(warnings)) : List.of();
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors, warnings);
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
