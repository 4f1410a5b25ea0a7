package com.pathway.simulator;

import com.pathway.rules.RuleSyntaxException;
import com.pathway.rules.VariablePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a simulation request before anything runs.
 */
public final class DistributionValidator {

    private DistributionValidator() {
    }

    /**
     * @throws InvalidDistributionException listing every problem found
     */
    public static void validate(int participantCount, int maxParticipants, Map<String, VariableDistribution> distributions) {
        List<String> errors = new ArrayList<>();
        if (participantCount < 1 || participantCount > maxParticipants) {
            errors.add("participantCount must be between 1 and " + maxParticipants + " (was " + participantCount + ")");
        }
        if (distributions != null) {
            distributions.forEach((path, distribution) -> {
                if (path == null || path.isBlank()) {
                    errors.add("variable path must not be blank");
                    return;
                }
                String pathProblem = pathProblem(path);
                if (pathProblem != null) {
                    errors.add(path + ": " + pathProblem);
                } else if (distribution == null) {
                    errors.add(path + ": missing distribution");
                } else {
                    errors.addAll(distribution.problems(path));
                }
            });
        }
        if (!errors.isEmpty()) {
            throw new InvalidDistributionException(errors);
        }
    }

    /** Null when the key parses as a rule variable path, otherwise the parse error. */
    private static String pathProblem(String path) {
        try {
            VariablePath.parse(path);
            return null;
        } catch (RuleSyntaxException e) {
            return "not a variable path (" + e.getMessage() + ")";
        }
    }
}
