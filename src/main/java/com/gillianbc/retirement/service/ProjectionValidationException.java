package com.gillianbc.retirement.service;

import java.util.List;

/**
 * Thrown before any year is simulated when a projection input breaks one or more invariants.
 */
public class ProjectionValidationException extends IllegalArgumentException {

    private final List<String> violations;

    public ProjectionValidationException(List<String> violations) {
        super("Invalid projection input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
