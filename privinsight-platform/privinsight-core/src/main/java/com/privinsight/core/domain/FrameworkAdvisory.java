package com.privinsight.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Advisory practice recommended by a framework whenever its metadata flag is not set.
 * Advisories never affect the score.
 */
@Embeddable
public class FrameworkAdvisory {

    @Column(name = "field_name", nullable = false, length = 64)
    private String field;

    @Column(name = "advice", nullable = false, length = 1024)
    private String advice;

    protected FrameworkAdvisory() {}

    public static FrameworkAdvisory of(String field, String advice) {
        if (field == null || field.isBlank() || advice == null || advice.isBlank()) {
            throw new IllegalArgumentException("Advisory field and advice are required");
        }
        FrameworkAdvisory advisory = new FrameworkAdvisory();
        advisory.field = field;
        advisory.advice = advice;
        return advisory;
    }

    public String getField() { return field; }
    public String getAdvice() { return advice; }
}
