package com.structdesign.core.design;

import com.structdesign.core.model.ElementKind;
import com.structdesign.core.model.FlexuralDesign;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.SectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Required tension and compression steel of a rectangular section in bending.
 *
 * <p>The factored moment is converted to the required nominal moment {@code Mn = Mu/φ} with
 * {@code φ = 0.90}. A section whose resistance coefficient exceeds the one at {@code ρmax} is
 * designed as doubly reinforced: tension steel at {@code ρmax} plus an equal increment of tension
 * and compression steel for the remaining moment.
 *
 * <p>Degenerate solves are clamped and logged, never thrown; the capacity checks then report them.
 */
public final class FlexuralDesigner {

    private static final Logger log = LoggerFactory.getLogger(FlexuralDesigner.class);

    /** Strength reduction factor for tension-controlled flexure. */
    public static final double PHI_FLEXURE = 0.90;

    private FlexuralDesigner() {
        // Utility class
    }

    /**
     * Designs the longitudinal steel for a factored moment.
     *
     * @param momentKNm factored moment (kN·m); its magnitude is designed for
     * @param section section geometry with the assumed bar sizes
     * @param materials material strengths
     * @return required steel and section classification
     */
    public static FlexuralDesign design(double momentKNm, SectionGeometry section, Materials materials) {
        double fc = materials.fc();
        double fy = materials.fy();
        double b = section.width();
        double d = section.effectiveDepth();

        double beta1 = MaterialModel.beta1(fc);
        double rhoMin = minimumRatio(section, materials);
        double rhoMax = MaterialModel.maximumRatio(fc, fy);
        double rnMax = resistanceCoefficient(rhoMax, fc, fy);
        double minArea = rhoMin * b * d;

        double mu = Math.abs(momentKNm) * 1e6;
        if (mu == 0.0) {
            log.debug("Zero moment on {} section, providing minimum steel {} mm2", section.kind().id(), minArea);
            return new FlexuralDesign(SectionMode.SINGLY_REINFORCED, beta1, rhoMin, rhoMax, 0.0, rnMax,
                minArea, 0.0, section.compressionSteelDepth(), false);
        }

        double mn = mu / PHI_FLEXURE;
        double rn = mn / (b * d * d);

        if (rn <= rnMax) {
            double discriminant = 1.0 - 2.0 * rn / (0.85 * fc);
            boolean clamped = false;
            double rho;
            if (discriminant < 0) {
                log.warn("Negative discriminant in flexural solve (Rn={}, fc={}); clamping to rhoMax={}",
                    rn, fc, rhoMax);
                rho = rhoMax;
                clamped = true;
            } else {
                rho = 0.85 * fc / fy * (1.0 - Math.sqrt(discriminant));
            }
            double area = Math.max(rho * b * d, minArea);
            log.debug("Singly reinforced: Rn={} <= RnMax={}, rho={}, As={} mm2", rn, rnMax, rho, area);
            return new FlexuralDesign(SectionMode.SINGLY_REINFORCED, beta1, rhoMin, rhoMax, rn, rnMax,
                area, 0.0, section.compressionSteelDepth(), clamped);
        }

        double tensionAtMax = rhoMax * b * d;
        double additionalMoment = mn - rnMax * b * d * d;
        double leverArm = section.steelLeverArm();
        if (leverArm <= 0) {
            log.warn("Section too shallow for compression steel (d={}, d'={}); clamping to rhoMax",
                d, section.compressionSteelDepth());
            return new FlexuralDesign(SectionMode.DOUBLY_REINFORCED, beta1, rhoMin, rhoMax, rn, rnMax,
                Math.max(tensionAtMax, minArea), 0.0, section.compressionSteelDepth(), true);
        }

        double compressionArea = additionalMoment / (fy * leverArm);
        double tensionArea = Math.max(tensionAtMax + compressionArea, minArea);
        log.debug("Doubly reinforced: Rn={} > RnMax={}, As={} mm2, As'={} mm2",
            rn, rnMax, tensionArea, compressionArea);
        return new FlexuralDesign(SectionMode.DOUBLY_REINFORCED, beta1, rhoMin, rhoMax, rn, rnMax,
            tensionArea, compressionArea, section.compressionSteelDepth(), false);
    }

    /**
     * Flexural resistance coefficient {@code Rn = ρ·fy·(1 − ρ·fy/(1.7·fc))} of the rectangular stress block.
     *
     * @param rho tension steel ratio
     * @param fc concrete strength (MPa)
     * @param fy steel yield strength (MPa)
     * @return Rn (MPa)
     */
    public static double resistanceCoefficient(double rho, double fc, double fy) {
        return rho * fy * (1.0 - rho * fy / (1.7 * fc));
    }

    /**
     * Minimum steel ratio on {@code b·d}: the flexural minimum for beams, the shrinkage minimum
     * {@code 0.0018·h/d} for slabs.
     *
     * @param section section geometry
     * @param materials material strengths
     * @return ρmin
     */
    public static double minimumRatio(SectionGeometry section, Materials materials) {
        if (section.kind() == ElementKind.SLAB) {
            return MaterialModel.SLAB_SHRINKAGE_RATIO * section.height() / section.effectiveDepth();
        }
        return MaterialModel.minimumRatio(materials.fc(), materials.fy());
    }
}
