package com.structdesign.core.design;

import com.structdesign.core.model.ElementKind;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.ShearDesign;
import com.structdesign.core.model.SpacingLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Concrete shear strength, required stirrup contribution and stirrup spacing limits.
 *
 * <p>The governing spacing is the minimum over every applicable limit, rounded down to a 5 mm
 * increment, so it never exceeds any single limit.
 */
public final class ShearDesigner {

    private static final Logger log = LoggerFactory.getLogger(ShearDesigner.class);

    /** Strength reduction factor for shear. */
    public static final double PHI_SHEAR = 0.75;

    /** Absolute maximum stirrup spacing (mm). */
    public static final double ABSOLUTE_MAX_SPACING = 300.0;

    /** Spacing increment stirrups are placed at (mm). */
    public static final double SPACING_INCREMENT = 5.0;

    /** Legs per stirrup. */
    public static final int STIRRUP_LEGS = 2;

    private ShearDesigner() {
        // Utility class
    }

    /**
     * Computes the shear demand on a section.
     *
     * @param shearKN factored shear (kN); its magnitude is designed for
     * @param axialKN factored axial compression (kN); enhances Vc of columns only
     * @param section section geometry
     * @param materials material strengths
     * @return shear design without spacing limits
     */
    public static ShearDesign design(double shearKN, double axialKN, SectionGeometry section, Materials materials) {
        double fc = materials.fc();
        double fy = materials.fy();
        double b = section.width();
        double d = section.effectiveDepth();
        double sqrtFc = Math.sqrt(fc);

        double vu = Math.abs(shearKN) * 1e3;
        double vc = concreteShearStrength(section, materials, axialKN);
        double vnRequired = vu / PHI_SHEAR;
        double vsRequired = Math.max(0.0, vnRequired - vc);
        double vsMax = 2.0 / 3.0 * sqrtFc * b * d;
        double avMin = Math.max(0.062 * sqrtFc * b / fy, 0.35 * b / fy);
        double avRequired = vsRequired / (fy * d);
        boolean highShear = vsRequired > sqrtFc * b * d / 3.0;
        boolean adequate = vsRequired <= vsMax;

        if (!adequate) {
            log.debug("Required Vs={} N exceeds section limit {} N", vsRequired, vsMax);
        }
        log.debug("Shear: Vu={} N, Vc={} N, Vs,req={} N, highShear={}", vu, vc, vsRequired, highShear);
        return new ShearDesign(vu, vc, vnRequired, vsRequired, vsMax, avMin, avRequired, highShear, adequate, null);
    }

    /**
     * Nominal concrete shear strength {@code (λ/6)·√fc·b·d}, times {@code 1 + Nu/(14·Ag)} for columns
     * in compression.
     *
     * @param section section geometry
     * @param materials material strengths
     * @param axialKN factored axial force (kN), compression positive
     * @return Vc (N)
     */
    public static double concreteShearStrength(SectionGeometry section, Materials materials, double axialKN) {
        double vc = MaterialModel.LAMBDA / 6.0 * Math.sqrt(materials.fc()) * section.width() * section.effectiveDepth();
        if (section.kind() == ElementKind.COLUMN && axialKN > 0) {
            vc *= 1.0 + axialKN * 1e3 / (14.0 * section.grossArea());
        }
        return vc;
    }

    /**
     * Computes every spacing limit for two-legged stirrups of the given diameter.
     *
     * @param shear shear demand
     * @param section section geometry
     * @param materials material strengths
     * @param stirrupDiameter stirrup diameter (mm)
     * @param mainBarDiameter longitudinal bar diameter (mm), used by the column tie limit
     * @return spacing limits with the governing spacing
     */
    public static SpacingLimits spacingLimits(ShearDesign shear, SectionGeometry section, Materials materials,
                                              int stirrupDiameter, int mainBarDiameter) {
        double legsArea = STIRRUP_LEGS * BarCatalog.area(stirrupDiameter);
        double d = section.effectiveDepth();

        Double fromMinimumArea = legsArea / shear.avMinPerLength();
        Double fromStrength = shear.vsRequired() > 0
            ? legsArea * materials.fy() * d / shear.vsRequired()
            : null;
        Double fromDepth = shear.highShear() ? d / 4.0 : d / 2.0;
        Double absoluteMaximum = ABSOLUTE_MAX_SPACING;
        Double fromDetailing = section.kind() == ElementKind.COLUMN
            ? Math.min(Math.min(16.0 * mainBarDiameter, 48.0 * stirrupDiameter), section.leastDimension())
            : null;

        double tightest = Stream.of(fromMinimumArea, fromStrength, fromDepth, absoluteMaximum, fromDetailing)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .min()
            .orElse(ABSOLUTE_MAX_SPACING);
        double governing = roundDownToIncrement(tightest);

        return new SpacingLimits(fromMinimumArea, fromStrength, fromDepth, absoluteMaximum, fromDetailing, governing);
    }

    /**
     * Rounds a spacing down to the placing increment, keeping spacings below one increment as they are.
     *
     * @param spacing spacing (mm)
     * @return rounded spacing, never above the input
     */
    static double roundDownToIncrement(double spacing) {
        if (spacing < SPACING_INCREMENT) {
            return spacing;
        }
        return Math.floor(spacing / SPACING_INCREMENT) * SPACING_INCREMENT;
    }
}
