package com.chronoplan.core.portfolio;

import java.util.List;

/**
 * Thrown when an ingested portfolio violates a domain rule (e.g. a task ending before it starts).
 */
public class InvalidPortfolioException extends RuntimeException {

    private final List<String> violations;

    public InvalidPortfolioException(List<String> violations) {
        super("Invalid portfolio: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
