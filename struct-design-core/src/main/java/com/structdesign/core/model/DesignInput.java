package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structdesign.core.exception.InvalidDesignInputException;

import java.util.Objects;

/**
 * Everything needed to design one element. Immutable and caller-constructed.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * id: B1
 * elementKind: beam
 * geometry:
 *   width: 300
 *   height: 500
 *   span: 6000
 *   clearCover: 40
 * materials:
 *   fc: 30
 *   fy: 400
 * forces:
 *   momentX: 180
 *   shearX: 120
 * constraints:
 *   exposure: moderate
 * }</pre>
 *
 * @param id caller label, defaults to the element kind id
 * @param elementKind beam, column or slab
 * @param geometry section geometry
 * @param materials material strengths
 * @param loads unfactored actions, informational
 * @param forces factored design actions
 * @param constraints optional serviceability constraints
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignInput(
    @JsonProperty("id") String id,
    @JsonProperty("elementKind") ElementKind elementKind,
    @JsonProperty("geometry") Geometry geometry,
    @JsonProperty("materials") Materials materials,
    @JsonProperty("loads") ServiceLoads loads,
    @JsonProperty("forces") DesignForces forces,
    @JsonProperty("constraints") DesignConstraints constraints
) {
    /**
     * Compact constructor with validation.
     */
    public DesignInput {
        if (elementKind == null) {
            throw new InvalidDesignInputException("elementKind", "must not be null");
        }
        Objects.requireNonNull(geometry, "geometry must not be null");
        Objects.requireNonNull(materials, "materials must not be null");
        if (id == null || id.isBlank()) {
            id = elementKind.id();
        }
        if (loads == null) {
            loads = ServiceLoads.none();
        }
        if (forces == null) {
            forces = DesignForces.none();
        }
        if (constraints == null) {
            constraints = DesignConstraints.none();
        }
    }

    /**
     * Creates an input without service loads or constraints.
     *
     * @param kind element kind
     * @param geometry geometry
     * @param materials materials
     * @param forces factored forces
     * @return design input
     */
    public static DesignInput of(ElementKind kind, Geometry geometry, Materials materials, DesignForces forces) {
        return new DesignInput(null, kind, geometry, materials, null, forces, null);
    }

    /**
     * Returns a copy with different forces, leaving everything else untouched.
     *
     * @param newForces replacement forces
     * @return new input
     */
    public DesignInput withForces(DesignForces newForces) {
        return new DesignInput(id, elementKind, geometry, materials, loads, newForces, constraints);
    }

    /**
     * Returns a copy with different materials.
     *
     * @param newMaterials replacement materials
     * @return new input
     */
    public DesignInput withMaterials(Materials newMaterials) {
        return new DesignInput(id, elementKind, geometry, newMaterials, loads, forces, constraints);
    }
}
