package com.privinsight.api.compliance;

import java.util.List;

/**
 * Raised when evaluation references framework ids that were never registered.
 * Distinct from a registered framework that evaluates as non-compliant.
 */
public class UnknownFrameworkException extends RuntimeException {

    private final List<String> frameworkIds;

    public UnknownFrameworkException(List<String> frameworkIds) {
        super("Unknown compliance framework(s): " + String.join(", ", frameworkIds));
        this.frameworkIds = List.copyOf(frameworkIds);
    }

    public List<String> getFrameworkIds() {
        return frameworkIds;
    }
}
