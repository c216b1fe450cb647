package com.privinsight.api.policy;

import java.util.List;

public class PolicyValidationException extends RuntimeException {

    private final List<String> errors;

    public PolicyValidationException(List<String> errors) {
        super("Invalid privacy policy: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
