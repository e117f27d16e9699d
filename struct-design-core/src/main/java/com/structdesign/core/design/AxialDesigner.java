package com.structdesign.core.design;

import com.structdesign.core.model.FlexuralDesign;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.SectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Longitudinal steel of a tied column under axial load and uniaxial moment.
 *
 * <p>The steel ratio starts at the largest of the 1 % minimum, the area the axial load needs and,
 * for columns loaded above 10 % of their minimum-steel capacity, 2 %. It then grows in steps of
 * 0.1 % until the linear interaction capacity {@code φMn·(1 − Pu/φPn,max)} covers the moment, up
 * to the 6 % maximum.
 */
public final class AxialDesigner {

    private static final Logger log = LoggerFactory.getLogger(AxialDesigner.class);

    /** Strength reduction factor of tied, compression-controlled columns. */
    public static final double PHI_COLUMN = 0.65;

    /** Reduction of the concentric capacity for accidental eccentricity of tied columns. */
    public static final double ECCENTRICITY_FACTOR = 0.80;

    public static final double MIN_RATIO = 0.01;
    public static final double MAX_RATIO = 0.06;

    static final double HEAVY_LOAD_RATIO = 0.02;
    private static final double RATIO_STEP = 0.001;

    private AxialDesigner() {
        // Utility class
    }

    /**
     * Designs the longitudinal steel of a column.
     *
     * @param axialKN factored axial force (kN), compression positive; tension is ignored
     * @param momentKNm factored moment (kN·m)
     * @param section column section
     * @param materials material strengths
     * @return required steel; {@code requiredTensionArea} holds the total longitudinal area
     */
    public static FlexuralDesign design(double axialKN, double momentKNm, SectionGeometry section, Materials materials) {
        double fc = materials.fc();
        double fy = materials.fy();
        double ag = section.grossArea();
        double pu = Math.max(0.0, axialKN) * 1e3;
        double mu = Math.abs(momentKNm) * 1e6;

        double ratio = MIN_RATIO;
        double forAxial = requiredAreaForAxial(pu, ag, fc, fy) / ag;
        ratio = Math.max(ratio, forAxial);
        if (pu > 0.1 * designAxialCapacity(MIN_RATIO * ag, ag, fc, fy)) {
            ratio = Math.max(ratio, HEAVY_LOAD_RATIO);
        }

        boolean clamped = false;
        while (interactionMomentCapacity(ratio * ag, pu, section, materials) < mu) {
            if (ratio >= MAX_RATIO) {
                break;
            }
            ratio = Math.min(MAX_RATIO, ratio + RATIO_STEP);
        }
        if (ratio > MAX_RATIO || interactionMomentCapacity(ratio * ag, pu, section, materials) < mu
            || designAxialCapacity(ratio * ag, ag, fc, fy) < pu) {
            log.warn("Column {}x{} cannot carry Pu={} kN, Mu={} kN·m within {}% steel; clamping",
                section.width(), section.height(), axialKN, momentKNm, MAX_RATIO * 100);
            ratio = Math.min(ratio, MAX_RATIO);
            clamped = true;
        }

        double area = ratio * ag;
        double d = section.effectiveDepth();
        double rn = mu / (PHI_COLUMN * section.width() * d * d);
        double rnMax = interactionMomentCapacity(MAX_RATIO * ag, pu, section, materials)
            / (PHI_COLUMN * section.width() * d * d);
        log.debug("Column: rho={}, Ast={} mm2 (Pu={} kN, Mu={} kN·m)", ratio, area, axialKN, momentKNm);
        return new FlexuralDesign(SectionMode.AXIAL, MaterialModel.beta1(fc), MIN_RATIO, MAX_RATIO, rn, rnMax,
            area, 0.0, section.compressionSteelDepth(), clamped);
    }

    /**
     * Design axial capacity {@code φ·0.80·[0.85·fc·(Ag − Ast) + fy·Ast]}.
     *
     * @param steelArea total longitudinal steel (mm²)
     * @param grossArea gross section area (mm²)
     * @param fc concrete strength (MPa)
     * @param fy steel yield strength (MPa)
     * @return φPn,max (N)
     */
    public static double designAxialCapacity(double steelArea, double grossArea, double fc, double fy) {
        return PHI_COLUMN * ECCENTRICITY_FACTOR * (0.85 * fc * (grossArea - steelArea) + fy * steelArea);
    }

    /**
     * Design moment capacity reduced linearly by the axial load, never negative.
     *
     * <p>{@code Mn = ½·Ast·fy·(d − d′)}: half the bars on each face.
     *
     * @param steelArea total longitudinal steel (mm²)
     * @param puN factored axial force (N)
     * @param section column section
     * @param materials material strengths
     * @return reduced φMn (N·mm)
     */
    public static double interactionMomentCapacity(double steelArea, double puN, SectionGeometry section,
                                                   Materials materials) {
        double phiPn = designAxialCapacity(steelArea, section.grossArea(), materials.fc(), materials.fy());
        double mn = 0.5 * steelArea * materials.fy() * Math.max(0.0, section.steelLeverArm());
        double reduction = phiPn > 0 ? Math.max(0.0, 1.0 - puN / phiPn) : 0.0;
        return PHI_COLUMN * mn * reduction;
    }

    private static double requiredAreaForAxial(double pu, double ag, double fc, double fy) {
        double denominator = fy - 0.85 * fc;
        if (denominator <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (pu / (PHI_COLUMN * ECCENTRICITY_FACTOR) - 0.85 * fc * ag) / denominator);
    }
}
