package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Selected reinforcement of an element.
 *
 * @param main primary (tension or longitudinal) bars
 * @param compression compression bars, {@code null} for singly reinforced sections
 * @param shear stirrups or ties
 * @param development detailing lengths for the main bars
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Reinforcement(
    ReinforcementSelection main,
    ReinforcementSelection compression,
    StirrupDetail shear,
    DevelopmentLengths development
) {
    /**
     * Compact constructor with validation.
     */
    public Reinforcement {
        Objects.requireNonNull(main, "main must not be null");
        Objects.requireNonNull(shear, "shear must not be null");
        Objects.requireNonNull(development, "development must not be null");
    }

    /**
     * Area of compression steel, zero when the section is singly reinforced.
     *
     * @return compression area (mm²)
     */
    public double compressionArea() {
        return compression != null ? compression.providedArea() : 0.0;
    }
}
