package com.ownmyhealth.phi.exception;

import java.util.List;

/**
 * Policy violation (password strength, email format). Carries every violated
 * rule, not only the first one.
 */
public class ValidationException extends PhiCoreException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(String.join(". ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return this.violations;
    }
}
