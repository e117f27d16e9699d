package com.structdesign.core.design;

/**
 * Derived properties of concrete and reinforcing steel.
 *
 * <p>All stresses in MPa. Normal-weight concrete (λ = 1) throughout.
 */
public final class MaterialModel {

    /** Elastic modulus of reinforcing steel (MPa). */
    public static final double STEEL_MODULUS = 200_000.0;

    /** Lightweight-concrete modification factor; 1.0 for normal-weight concrete. */
    public static final double LAMBDA = 1.0;

    /** Net tensile strain at which a section is tension-controlled. */
    public static final double TENSION_CONTROLLED_STRAIN = 0.004;

    /** Ultimate concrete compressive strain used for compression steel stress. */
    public static final double CONCRETE_ULTIMATE_STRAIN = 0.003;

    /** Shrinkage and temperature steel ratio of slabs, on the gross section. */
    public static final double SLAB_SHRINKAGE_RATIO = 0.0018;

    private MaterialModel() {
        // Utility class
    }

    /**
     * Stress-block depth factor β1: 0.85 up to 28 MPa, linear down to 0.65 at 55 MPa, 0.65 above.
     *
     * @param fc concrete strength
     * @return β1
     */
    public static double beta1(double fc) {
        if (fc <= 28.0) {
            return 0.85;
        }
        if (fc >= 55.0) {
            return 0.65;
        }
        return 0.85 - 0.20 * (fc - 28.0) / 27.0;
    }

    /**
     * Concrete elastic modulus {@code 4700·√fc}.
     *
     * @param fc concrete strength
     * @return Ec (MPa)
     */
    public static double concreteModulus(double fc) {
        return 4700.0 * Math.sqrt(fc);
    }

    /**
     * Modular ratio {@code Es/Ec}.
     *
     * @param fc concrete strength
     * @return n
     */
    public static double modularRatio(double fc) {
        return STEEL_MODULUS / concreteModulus(fc);
    }

    /**
     * Modulus of rupture {@code 0.62·λ·√fc}.
     *
     * @param fc concrete strength
     * @return fr (MPa)
     */
    public static double modulusOfRupture(double fc) {
        return 0.62 * LAMBDA * Math.sqrt(fc);
    }

    /**
     * Balanced reinforcement ratio {@code 0.85·β1·fc/fy · 600/(600+fy)}.
     */
    public static double balancedRatio(double fc, double fy) {
        return 0.85 * beta1(fc) * fc / fy * 600.0 / (600.0 + fy);
    }

    /**
     * Maximum tension steel ratio of a singly reinforced section, {@code 0.75·ρb}.
     */
    public static double maximumRatio(double fc, double fy) {
        return 0.75 * balancedRatio(fc, fy);
    }

    /**
     * Minimum flexural steel ratio {@code max(1.4/fy, √fc/(4·fy))}.
     */
    public static double minimumRatio(double fc, double fy) {
        return Math.max(1.4 / fy, Math.sqrt(fc) / (4.0 * fy));
    }

    /**
     * Steel yield strain {@code fy/Es}.
     *
     * @param fy steel yield strength
     * @return εy
     */
    public static double yieldStrain(double fy) {
        return fy / STEEL_MODULUS;
    }
}
