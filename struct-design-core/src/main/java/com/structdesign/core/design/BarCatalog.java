package com.structdesign.core.design;

import com.structdesign.core.model.BarSize;

import java.util.List;
import java.util.Optional;

/**
 * Standard deformed bar sizes, ascending by diameter, and the stirrup diameters.
 */
public final class BarCatalog {

    private static final List<BarSize> BARS = List.of(
        new BarSize(10, 78.5),
        new BarSize(12, 113.0),
        new BarSize(16, 201.0),
        new BarSize(19, 284.0),
        new BarSize(22, 380.0),
        new BarSize(25, 491.0),
        new BarSize(29, 661.0),
        new BarSize(32, 804.0)
    );

    private static final List<Integer> STIRRUP_DIAMETERS = List.of(8, 10, 12, 13, 16);

    private BarCatalog() {
        // Utility class
    }

    /**
     * Returns the catalog of main bars, ascending by diameter.
     *
     * @return immutable list of bar sizes
     */
    public static List<BarSize> bars() {
        return BARS;
    }

    /**
     * Returns the stirrup diameters, ascending.
     *
     * @return immutable list of diameters (mm)
     */
    public static List<Integer> stirrupDiameters() {
        return STIRRUP_DIAMETERS;
    }

    public static Optional<BarSize> find(int diameter) {
        return BARS.stream().filter(bar -> bar.diameter() == diameter).findFirst();
    }

    /**
     * Area of one bar of the given diameter: the catalog area when listed, else {@code π·d²/4}.
     *
     * @param diameter bar diameter (mm)
     * @return area (mm²)
     */
    public static double area(int diameter) {
        return find(diameter)
            .map(BarSize::area)
            .orElse(Math.PI * diameter * diameter / 4.0);
    }
}
