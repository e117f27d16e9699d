package com.structdesign.core.design;

import com.structdesign.core.model.DesignCheck;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.ReinforcementSelection;
import com.structdesign.core.model.ShearDesign;
import com.structdesign.core.model.StirrupDetail;

/**
 * Capacity checks recomputed from the selected bars, not from the continuous required areas.
 *
 * <p>Strength checks report demand and design capacity in kN or kN·m. A flexural check fails when
 * the section is not tension-controlled, whatever its moment capacity.
 */
public final class CapacityVerifier {

    private CapacityVerifier() {
        // Utility class
    }

    /**
     * Nominal flexural capacity of a rectangular section.
     *
     * @param nominalMoment Mn (N·mm)
     * @param neutralAxisDepth c (mm)
     * @param compressionSteelStress stress in the compression steel at nominal strength (MPa)
     */
    public record FlexuralCapacity(double nominalMoment, double neutralAxisDepth, double compressionSteelStress) {

        /**
         * Design moment capacity.
         *
         * @return φMn (kN·m)
         */
        public double designMomentKNm() {
            return FlexuralDesigner.PHI_FLEXURE * nominalMoment / 1e6;
        }
    }

    /**
     * Computes Mn and c for the given tension and compression steel.
     *
     * <p>Compression steel is first assumed to yield; when strain compatibility shows it does not,
     * the neutral axis is solved from the quadratic equilibrium equation.
     *
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param tensionArea provided tension steel (mm²)
     * @param compressionArea provided compression steel (mm²), 0 for singly reinforced sections
     * @return nominal capacity
     */
    public static FlexuralCapacity flexuralCapacity(SectionGeometry section, Materials materials,
                                                    double tensionArea, double compressionArea) {
        double fc = materials.fc();
        double fy = materials.fy();
        double b = section.width();
        double d = section.effectiveDepth();
        double dPrime = section.compressionSteelDepth();
        double beta1 = MaterialModel.beta1(fc);
        double blockForce = 0.85 * fc * b * beta1;

        if (compressionArea <= 0) {
            double c = tensionArea * fy / blockForce;
            double a = beta1 * c;
            return new FlexuralCapacity(tensionArea * fy * (d - a / 2.0), c, 0.0);
        }

        double ecu = MaterialModel.CONCRETE_ULTIMATE_STRAIN;
        double es = MaterialModel.STEEL_MODULUS;
        double c = (tensionArea - compressionArea) * fy / blockForce;
        double fsPrime = c > 0 ? es * ecu * (c - dPrime) / c : Double.NEGATIVE_INFINITY;
        if (fsPrime < fy) {
            // 0.85·fc·b·β1·c² + (Es·εcu·As′ − As·fy)·c − Es·εcu·As′·d′ = 0
            double qb = es * ecu * compressionArea - tensionArea * fy;
            double qc = -es * ecu * compressionArea * dPrime;
            c = (-qb + Math.sqrt(qb * qb - 4.0 * blockForce * qc)) / (2.0 * blockForce);
            fsPrime = Math.max(-fy, Math.min(fy, es * ecu * (c - dPrime) / c));
        } else {
            fsPrime = fy;
        }
        double a = beta1 * c;
        double mn = blockForce * c * (d - a / 2.0) + compressionArea * fsPrime * (d - dPrime);
        return new FlexuralCapacity(mn, c, fsPrime);
    }

    /**
     * Largest neutral-axis depth of a tension-controlled section,
     * {@code cb = εt·d/(εt + fy/Es)} with {@code εt = 0.004}.
     *
     * @param section section geometry
     * @param materials material strengths
     * @return limiting c (mm)
     */
    public static double tensionControlledDepth(SectionGeometry section, Materials materials) {
        double et = MaterialModel.TENSION_CONTROLLED_STRAIN;
        return et * section.effectiveDepth() / (et + MaterialModel.yieldStrain(materials.fy()));
    }

    /**
     * Flexural strength and ductility of a beam or slab.
     *
     * @param momentKNm factored moment (kN·m)
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param tensionArea provided tension steel (mm²)
     * @param compressionArea provided compression steel (mm²)
     * @return check in kN·m
     */
    public static DesignCheck flexure(double momentKNm, SectionGeometry section, Materials materials,
                                      double tensionArea, double compressionArea) {
        FlexuralCapacity capacity = flexuralCapacity(section, materials, tensionArea, compressionArea);
        boolean tensionControlled = capacity.neutralAxisDepth() <= tensionControlledDepth(section, materials);
        return DesignCheck.atLeast(Math.abs(momentKNm), capacity.designMomentKNm(), tensionControlled);
    }

    /**
     * Shear strength {@code φ·(Vc + Vs)} with stirrups, Vs capped at the section limit.
     *
     * @param shear shear demand
     * @param stirrups selected stirrups
     * @param section section with the selected bar sizes
     * @param materials material strengths
     * @param axialKN factored axial force (kN), enhances Vc of columns
     * @return check in kN
     */
    public static DesignCheck shear(ShearDesign shear, StirrupDetail stirrups, SectionGeometry section,
                                    Materials materials, double axialKN) {
        double vc = ShearDesigner.concreteShearStrength(section, materials, axialKN);
        double vs = 0.0;
        if (stirrups.present()) {
            double legsArea = stirrups.legs() * BarCatalog.area(stirrups.diameter());
            vs = legsArea * materials.fy() * section.effectiveDepth() / stirrups.spacing();
            vs = Math.min(vs, 2.0 / 3.0 * Math.sqrt(materials.fc()) * section.width() * section.effectiveDepth());
        }
        double capacity = ShearDesigner.PHI_SHEAR * (vc + vs);
        return DesignCheck.atLeast(shear.vu() / 1e3, capacity / 1e3);
    }

    /**
     * Axial strength of a tied column.
     *
     * @param axialKN factored axial force (kN)
     * @param section column section
     * @param materials material strengths
     * @param steelArea provided longitudinal steel (mm²)
     * @return check in kN
     */
    public static DesignCheck axial(double axialKN, SectionGeometry section, Materials materials, double steelArea) {
        double capacity = AxialDesigner.designAxialCapacity(steelArea, section.grossArea(), materials.fc(),
            materials.fy());
        return DesignCheck.atLeast(Math.max(0.0, axialKN), capacity / 1e3);
    }

    /**
     * Column flexure under axial load, by linear interaction.
     *
     * @param axialKN factored axial force (kN)
     * @param momentKNm factored moment (kN·m)
     * @param section column section with the selected bar sizes
     * @param materials material strengths
     * @param steelArea provided longitudinal steel (mm²)
     * @return check in kN·m
     */
    public static DesignCheck columnFlexure(double axialKN, double momentKNm, SectionGeometry section,
                                            Materials materials, double steelArea) {
        double capacity = AxialDesigner.interactionMomentCapacity(steelArea, Math.max(0.0, axialKN) * 1e3,
            section, materials);
        return DesignCheck.atLeast(Math.abs(momentKNm), capacity / 1e6);
    }

    /**
     * Minimum steel: provided area at least the required minimum.
     */
    public static DesignCheck minimumReinforcement(double minimumArea, ReinforcementSelection main) {
        return DesignCheck.atLeast(minimumArea, main.providedArea());
    }

    /**
     * Maximum steel: provided area at most the allowable maximum.
     */
    public static DesignCheck maximumReinforcement(double maximumArea, ReinforcementSelection main) {
        return DesignCheck.atMost(main.providedArea(), maximumArea);
    }
}
