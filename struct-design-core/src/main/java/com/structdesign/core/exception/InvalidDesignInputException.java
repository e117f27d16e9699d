package com.structdesign.core.exception;

/**
 * Thrown when a design input violates a hard precondition (non-positive dimension,
 * non-positive material strength, a cover that leaves no effective depth).
 *
 * <p>Design inadequacy is never reported through this exception; it is carried as
 * failed checks inside {@link com.structdesign.core.model.DesignResult}.
 */
public class InvalidDesignInputException extends IllegalArgumentException {

    private final String field;

    public InvalidDesignInputException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    /**
     * Returns the dotted path of the offending input field, e.g. {@code geometry.width}.
     *
     * @return offending field name
     */
    public String getField() {
        return field;
    }

    /**
     * Throws when {@code value} is not strictly positive (NaN included).
     *
     * @param field dotted field name
     * @param value value to check
     * @throws InvalidDesignInputException if the value is not a positive finite number
     */
    public static void requirePositive(String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidDesignInputException(field, "must be a positive number but was " + value);
        }
    }

    /**
     * Throws when {@code value} is negative or not finite.
     *
     * @param field dotted field name
     * @param value value to check
     * @throws InvalidDesignInputException if the value is negative or not finite
     */
    public static void requireNonNegative(String field, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidDesignInputException(field, "must be zero or positive but was " + value);
        }
    }
}
