package com.structdesign.core.model;

/**
 * A standard deformed bar size.
 *
 * @param diameter nominal diameter (mm)
 * @param area nominal cross-sectional area (mm²)
 */
public record BarSize(int diameter, double area) {

    /**
     * Compact constructor with validation.
     */
    public BarSize {
        if (diameter <= 0 || area <= 0) {
            throw new IllegalArgumentException("bar diameter and area must be > 0");
        }
    }

    /**
     * Mass per metre of bar.
     *
     * @return unit weight (kg/m)
     */
    public double unitWeight() {
        return area * 7.85e-3;
    }
}
