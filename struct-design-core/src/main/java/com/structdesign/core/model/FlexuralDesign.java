package com.structdesign.core.model;

import java.util.Objects;

/**
 * Required longitudinal steel, before discretization into bars.
 *
 * @param mode singly reinforced, doubly reinforced or axial (columns)
 * @param beta1 stress-block depth factor
 * @param rhoMin minimum tension steel ratio
 * @param rhoMax maximum tension steel ratio
 * @param rn flexural resistance coefficient of the demand (MPa)
 * @param rnMax resistance coefficient at the maximum ratio (MPa)
 * @param requiredTensionArea required tension (or total column) steel (mm²)
 * @param requiredCompressionArea required compression steel (mm²), 0 when singly reinforced
 * @param compressionSteelDepth depth to the compression steel centroid d′ (mm)
 * @param clamped whether a degenerate solve was clamped to the nearest valid boundary
 */
public record FlexuralDesign(
    SectionMode mode,
    double beta1,
    double rhoMin,
    double rhoMax,
    double rn,
    double rnMax,
    double requiredTensionArea,
    double requiredCompressionArea,
    double compressionSteelDepth,
    boolean clamped
) {
    /**
     * Compact constructor with validation.
     */
    public FlexuralDesign {
        Objects.requireNonNull(mode, "mode must not be null");
        if (requiredTensionArea < 0 || requiredCompressionArea < 0) {
            throw new IllegalArgumentException("required steel areas must be >= 0");
        }
    }

    public boolean doublyReinforced() {
        return mode == SectionMode.DOUBLY_REINFORCED;
    }
}
