package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Factored design actions. Signed; the engine designs for magnitudes.
 *
 * @param momentX factored moment about the major axis (kN·m)
 * @param momentY factored moment about the minor axis (kN·m)
 * @param shearX factored shear along the major axis (kN)
 * @param shearY factored shear along the minor axis (kN)
 * @param axial factored axial force (kN), compression positive
 * @param torsion factored torsion (kN·m)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignForces(
    @JsonProperty("momentX") double momentX,
    @JsonProperty("momentY") double momentY,
    @JsonProperty("shearX") double shearX,
    @JsonProperty("shearY") double shearY,
    @JsonProperty("axial") double axial,
    @JsonProperty("torsion") double torsion
) {
    private static final DesignForces NONE = new DesignForces(0, 0, 0, 0, 0, 0);

    public static DesignForces none() {
        return NONE;
    }

    /**
     * Forces for a member in major-axis bending and shear only.
     *
     * @param moment factored moment (kN·m)
     * @param shear factored shear (kN)
     * @return forces with the remaining actions zero
     */
    public static DesignForces bending(double moment, double shear) {
        return new DesignForces(moment, 0, shear, 0, 0, 0);
    }

    /**
     * Forces for a column carrying axial load with major-axis moment and shear.
     *
     * @param axial factored axial force (kN)
     * @param moment factored moment (kN·m)
     * @param shear factored shear (kN)
     * @return column forces
     */
    public static DesignForces column(double axial, double moment, double shear) {
        return new DesignForces(moment, 0, shear, 0, axial, 0);
    }
}
