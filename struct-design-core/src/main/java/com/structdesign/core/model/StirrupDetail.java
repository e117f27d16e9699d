package com.structdesign.core.model;

/**
 * Transverse reinforcement (stirrups for beams, ties for columns).
 *
 * @param diameter stirrup bar diameter (mm), 0 when none
 * @param legs number of vertical legs
 * @param spacing centre-to-centre spacing (mm), 0 when none
 * @param areaPerLength provided {@code Av/s} (mm²/mm)
 * @param constructible whether the spacing reaches the practical minimum
 */
public record StirrupDetail(
    int diameter,
    int legs,
    double spacing,
    double areaPerLength,
    boolean constructible
) {
    private static final StirrupDetail NONE = new StirrupDetail(0, 0, 0, 0, true);

    /**
     * Compact constructor with validation.
     */
    public StirrupDetail {
        if (diameter < 0 || legs < 0 || spacing < 0) {
            throw new IllegalArgumentException("stirrup dimensions must be >= 0");
        }
    }

    /**
     * Placeholder for elements without transverse steel (slabs).
     *
     * @return empty stirrup detail
     */
    public static StirrupDetail none() {
        return NONE;
    }

    public boolean present() {
        return diameter > 0 && spacing > 0;
    }

    /**
     * Short notation such as {@code D10-150}.
     *
     * @return stirrup notation, or {@code -} when none
     */
    public String notation() {
        return present() ? "D" + diameter + "-" + Math.round(spacing) : "-";
    }
}
