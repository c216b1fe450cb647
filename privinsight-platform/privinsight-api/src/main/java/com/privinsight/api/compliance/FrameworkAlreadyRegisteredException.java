package com.privinsight.api.compliance;

public class FrameworkAlreadyRegisteredException extends RuntimeException {

    public FrameworkAlreadyRegisteredException(String frameworkId) {
        super("Compliance framework already registered: " + frameworkId
                + " (register a new version under a new id)");
    }
}
