package com.structdesign.core.model;

import java.util.Objects;

/**
 * A constructible group of identical bars.
 *
 * @param diameter nominal bar diameter (mm), from the standard catalog
 * @param count number of bars
 * @param barArea area of one bar (mm²)
 * @param providedArea {@code count × barArea} (mm²)
 * @param layout drawing hint derived from the count
 */
public record ReinforcementSelection(
    int diameter,
    int count,
    double barArea,
    double providedArea,
    BarLayout layout
) {
    /**
     * Compact constructor with validation.
     */
    public ReinforcementSelection {
        if (diameter <= 0) {
            throw new IllegalArgumentException("diameter must be > 0");
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        Objects.requireNonNull(layout, "layout must not be null");
    }

    /**
     * Builds a selection from a bar size and count, deriving area and layout.
     *
     * @param diameter bar diameter (mm)
     * @param barArea area of one bar (mm²)
     * @param count number of bars
     * @return selection
     */
    public static ReinforcementSelection of(int diameter, double barArea, int count) {
        return new ReinforcementSelection(diameter, count, barArea, count * barArea, BarLayout.forCount(count));
    }

    /**
     * Short notation such as {@code 4D19}.
     *
     * @return bar notation
     */
    public String notation() {
        return count + "D" + diameter;
    }
}
