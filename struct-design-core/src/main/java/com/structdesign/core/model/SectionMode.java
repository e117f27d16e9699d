package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the longitudinal steel of a section was designed.
 */
public enum SectionMode {
    /** Tension steel alone carries the moment below the maximum ratio. */
    SINGLY_REINFORCED("singly_reinforced"),
    /** Compression steel added for the moment beyond the single-reinforcement limit. */
    DOUBLY_REINFORCED("doubly_reinforced"),
    /** Column steel sized for axial load and minimum ratio. */
    AXIAL("axial");

    private final String id;

    SectionMode(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
