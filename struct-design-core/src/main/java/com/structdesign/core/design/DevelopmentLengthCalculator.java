package com.structdesign.core.design;

import com.structdesign.core.model.DevelopmentLengths;
import com.structdesign.core.model.Materials;

/**
 * Development and splice lengths of deformed bars, rounded to whole millimeters.
 */
public final class DevelopmentLengthCalculator {

    /** Tension lap splice factor (class B splice). */
    static final double SPLICE_FACTOR = 1.3;

    private DevelopmentLengthCalculator() {
        // Utility class
    }

    /**
     * Computes the detailing lengths of a bar.
     *
     * @param barDiameter bar diameter (mm)
     * @param materials material strengths
     * @return development lengths
     */
    public static DevelopmentLengths calculate(int barDiameter, Materials materials) {
        double db = barDiameter;
        double sqrtFc = Math.sqrt(materials.fc());
        double fy = materials.fy();

        double tension = Math.max(Math.max(fy * db / (25.0 * MaterialModel.LAMBDA * sqrtFc), 12.0 * db), 300.0);
        double compression = Math.max(Math.max(0.24 * fy * db / sqrtFc, 8.0 * db), 200.0);
        double hook = Math.max(Math.max(0.02 * fy * db / sqrtFc, 8.0 * db), 150.0);
        double splice = SPLICE_FACTOR * tension;

        return new DevelopmentLengths(Math.round(tension), Math.round(compression), Math.round(hook),
            Math.round(splice));
    }
}
