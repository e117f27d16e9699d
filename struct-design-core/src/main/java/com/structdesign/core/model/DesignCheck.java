package com.structdesign.core.model;

import java.util.Objects;

/**
 * One capacity or serviceability check.
 *
 * <p>{@code ratio = provided / required}, so {@code ratio >= 1} always reads "adequate". For
 * upper-bound checks (deflection, crack width, maximum steel) {@code required} is the computed
 * value and {@code provided} the allowable limit. The ratio is capped at {@link #MAX_RATIO} and
 * set to it when nothing is required.
 *
 * @param required demand (or computed value for upper-bound checks)
 * @param provided capacity (or allowable limit for upper-bound checks)
 * @param ratio provided over required
 * @param status verdict
 */
public record DesignCheck(
    double required,
    double provided,
    double ratio,
    CheckStatus status
) {
    /** Ceiling for reported ratios, also used when the requirement is zero. */
    public static final double MAX_RATIO = 99.99;

    private static final DesignCheck NOT_APPLICABLE = new DesignCheck(0, 0, 1.0, CheckStatus.PASS);

    /**
     * Compact constructor with validation.
     */
    public DesignCheck {
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Lower-bound check: passes when {@code provided >= required}.
     *
     * @param required demand
     * @param provided capacity
     * @return check
     */
    public static DesignCheck atLeast(double required, double provided) {
        return new DesignCheck(required, provided, ratio(required, provided), CheckStatus.of(provided >= required));
    }

    /**
     * Lower-bound check with an extra condition that must also hold.
     *
     * @param required demand
     * @param provided capacity
     * @param condition additional condition, e.g. ductility
     * @return check
     */
    public static DesignCheck atLeast(double required, double provided, boolean condition) {
        return new DesignCheck(required, provided, ratio(required, provided),
            CheckStatus.of(condition && provided >= required));
    }

    /**
     * Upper-bound check: passes when {@code calculated <= allowable}.
     *
     * @param calculated computed value
     * @param allowable limit
     * @return check
     */
    public static DesignCheck atMost(double calculated, double allowable) {
        return new DesignCheck(calculated, allowable, ratio(calculated, allowable),
            CheckStatus.of(calculated <= allowable));
    }

    /**
     * Check that does not apply to the element kind.
     *
     * @return a passing placeholder check
     */
    public static DesignCheck notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean passed() {
        return status == CheckStatus.PASS;
    }

    static double ratio(double required, double provided) {
        if (required <= 0) {
            return MAX_RATIO;
        }
        return Math.min(MAX_RATIO, Math.max(0.0, provided / required));
    }
}
