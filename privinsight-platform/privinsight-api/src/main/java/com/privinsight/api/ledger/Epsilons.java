package com.privinsight.api.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point epsilon arithmetic. All budget amounts carry six decimal places.
 */
public final class Epsilons {

    public static final int SCALE = 6;

    private Epsilons() {}

    /**
     * Normalizes a requested epsilon to ledger scale.
     *
     * @throws IllegalArgumentException for null, non-positive, or over-precise values
     */
    public static BigDecimal normalize(BigDecimal epsilon) {
        if (epsilon == null) {
            throw new IllegalArgumentException("Epsilon cannot be null");
        }
        if (epsilon.signum() <= 0) {
            throw new IllegalArgumentException("Epsilon must be positive: " + epsilon);
        }
        try {
            return epsilon.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Epsilon has more than " + SCALE + " decimal places: " + epsilon);
        }
    }
}
