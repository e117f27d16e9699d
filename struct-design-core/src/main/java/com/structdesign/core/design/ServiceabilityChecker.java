package com.structdesign.core.design;

import com.structdesign.core.model.DesignCheck;
import com.structdesign.core.model.ElementKind;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.ReinforcementSelection;

/**
 * Immediate deflection and crack width under service load.
 *
 * <p>Deflection uses the effective moment of inertia of the cracked section and the midspan
 * deflection of a simply supported member under uniform load. Crack width follows the
 * Gergely-Lutz expression {@code w = 11e-6·β·fs·∛(dc·A)} (mm, MPa), with {@code fs = 0.6·fy}
 * and a strain gradient factor β fixed per element kind. The width never grows with the steel area.
 */
public final class ServiceabilityChecker {

    /** Service steel stress as a fraction of fy. */
    static final double SERVICE_STRESS_RATIO = 0.6;

    /** Gergely-Lutz coefficient in N and mm units, expressed against Es. */
    static final double CRACK_COEFFICIENT = 2.2;

    /** Strain gradient factor β for beams and columns. */
    static final double BEAM_STRAIN_GRADIENT = 1.20;

    /** Strain gradient factor β for slabs. */
    static final double SLAB_STRAIN_GRADIENT = 1.35;

    private ServiceabilityChecker() {
        // Utility class
    }

    /**
     * Section stiffness under a service moment.
     *
     * @param grossInertia Ig (mm⁴)
     * @param crackingMoment Mcr (N·mm)
     * @param neutralAxisDepth cracked elastic neutral axis depth kd (mm)
     * @param crackedInertia Icr (mm⁴)
     * @param effectiveInertia Ie (mm⁴), never above Ig
     */
    public record SectionStiffness(
        double grossInertia,
        double crackingMoment,
        double neutralAxisDepth,
        double crackedInertia,
        double effectiveInertia
    ) {
    }

    /**
     * Computes Ig, Mcr, Icr and the effective inertia {@code Ie = Icr + (Ig − Icr)·(Mcr/Ma)³}.
     *
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param tensionArea provided tension steel (mm²)
     * @param serviceMoment service moment Ma (N·mm)
     * @return section stiffness
     */
    public static SectionStiffness stiffness(SectionGeometry section, Materials materials, double tensionArea,
                                             double serviceMoment) {
        double b = section.width();
        double h = section.height();
        double d = section.effectiveDepth();
        double ig = section.grossInertia();
        double mcr = MaterialModel.modulusOfRupture(materials.fc()) * ig / (h / 2.0);
        double n = MaterialModel.modularRatio(materials.fc());
        double kd = crackedNeutralAxis(section, materials, tensionArea);
        double icr = b * Math.pow(kd, 3) / 3.0 + n * tensionArea * Math.pow(d - kd, 2);

        double ie;
        double ma = Math.abs(serviceMoment);
        if (ma > mcr) {
            double ratio = Math.pow(mcr / ma, 3);
            ie = Math.min(ig, icr + (ig - icr) * ratio);
        } else {
            ie = ig;
        }
        return new SectionStiffness(ig, mcr, kd, icr, ie);
    }

    /**
     * Depth of the cracked elastic neutral axis, {@code k·d} with
     * {@code k = √(2ρn + (ρn)²) − ρn}.
     *
     * @param section section geometry
     * @param materials material strengths
     * @param tensionArea tension steel (mm²)
     * @return kd (mm)
     */
    public static double crackedNeutralAxis(SectionGeometry section, Materials materials, double tensionArea) {
        double d = section.effectiveDepth();
        double rhoN = tensionArea / (section.width() * d) * MaterialModel.modularRatio(materials.fc());
        double k = Math.sqrt(2.0 * rhoN + rhoN * rhoN) - rhoN;
        return k * d;
    }

    /**
     * Midspan deflection {@code 5·Ma·L²/(48·Ec·Ie)} of a simply supported member.
     *
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param tensionArea provided tension steel (mm²)
     * @param serviceMoment service moment Ma (N·mm)
     * @param span span L (mm)
     * @return deflection (mm)
     */
    public static double deflection(SectionGeometry section, Materials materials, double tensionArea,
                                    double serviceMoment, double span) {
        SectionStiffness stiffness = stiffness(section, materials, tensionArea, serviceMoment);
        double ec = MaterialModel.concreteModulus(materials.fc());
        return 5.0 * Math.abs(serviceMoment) * span * span / (48.0 * ec * stiffness.effectiveInertia());
    }

    /**
     * Maximum crack width at the tension face.
     *
     * <p>{@code dc} is the concrete cover to the centre of the bars and {@code A} the concrete area
     * around the tension steel, {@code 2·dc·b}, per bar.
     *
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param main selected tension bars
     * @return crack width (mm)
     */
    public static double crackWidth(SectionGeometry section, Materials materials, ReinforcementSelection main) {
        double beta = strainGradient(section.kind());
        double fs = SERVICE_STRESS_RATIO * materials.fy();
        double dc = section.height() - section.effectiveDepth();
        double areaPerBar = 2.0 * dc * section.width() / main.count();
        return CRACK_COEFFICIENT * beta * fs / MaterialModel.STEEL_MODULUS * Math.cbrt(dc * areaPerBar);
    }

    /**
     * Ratio of the strain at the tension face to the strain at the steel centroid.
     *
     * @param kind element kind
     * @return β
     */
    static double strainGradient(ElementKind kind) {
        return kind == ElementKind.SLAB ? SLAB_STRAIN_GRADIENT : BEAM_STRAIN_GRADIENT;
    }

    /**
     * Deflection check against {@code span/N}.
     *
     * @return check in mm; computed deflection as required, allowable as provided
     */
    public static DesignCheck deflectionCheck(SectionGeometry section, Materials materials, double tensionArea,
                                              double serviceMoment, double span, double limitDenominator) {
        double deflection = deflection(section, materials, tensionArea, serviceMoment, span);
        return DesignCheck.atMost(deflection, span / limitDenominator);
    }

    /**
     * Crack width check against the allowable width.
     *
     * @return check in mm; computed width as required, allowable as provided
     */
    public static DesignCheck crackingCheck(SectionGeometry section, Materials materials, ReinforcementSelection main,
                                            double allowableWidth) {
        return DesignCheck.atMost(crackWidth(section, materials, main), allowableWidth);
    }
}
