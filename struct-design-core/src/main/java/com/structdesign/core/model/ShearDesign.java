package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Shear demand on a section and the steel it calls for.
 *
 * @param vu factored shear (N)
 * @param vc nominal concrete shear strength (N)
 * @param vnRequired required nominal strength {@code Vu/φ} (N)
 * @param vsRequired required steel contribution {@code max(0, Vn,req − Vc)} (N)
 * @param vsMax largest steel contribution the section can develop (N)
 * @param avMinPerLength minimum shear steel per unit length (mm²/mm)
 * @param avRequiredPerLength steel per unit length for {@code Vs,req} (mm²/mm)
 * @param highShear whether {@code Vs,req} exceeds ⅓·√fc·b·d, tightening the spacing limits
 * @param sectionAdequate whether {@code Vs,req <= Vs,max}
 * @param spacing stirrup spacing limits, {@code null} when the element carries no stirrups
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShearDesign(
    double vu,
    double vc,
    double vnRequired,
    double vsRequired,
    double vsMax,
    double avMinPerLength,
    double avRequiredPerLength,
    boolean highShear,
    boolean sectionAdequate,
    SpacingLimits spacing
) {
    /**
     * Governing steel demand per unit length: the larger of strength and minimum requirements.
     *
     * @return design {@code Av/s} (mm²/mm)
     */
    public double governingAreaPerLength() {
        return Math.max(avMinPerLength, avRequiredPerLength);
    }

    /**
     * Returns a copy carrying the stirrup spacing limits.
     *
     * @param limits spacing limits of the selected stirrups
     * @return shear design with spacing
     */
    public ShearDesign withSpacing(SpacingLimits limits) {
        return new ShearDesign(vu, vc, vnRequired, vsRequired, vsMax, avMinPerLength, avRequiredPerLength,
            highShear, sectionAdequate, limits);
    }
}
