package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Resolved element dimensions and grade labels echoed back to callers.
 *
 * @param kind element kind
 * @param width design width (mm); 1000 for slab strips
 * @param height overall depth (mm)
 * @param span member length used in the design (mm), {@code null} for columns without a height
 * @param effectiveDepth effective depth to the selected tension steel (mm)
 * @param concreteGrade concrete grade label
 * @param steelGrade steel grade label
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ElementSummary(
    ElementKind kind,
    double width,
    double height,
    Double span,
    double effectiveDepth,
    String concreteGrade,
    String steelGrade
) {
    /**
     * Compact constructor with validation.
     */
    public ElementSummary {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(concreteGrade, "concreteGrade must not be null");
        Objects.requireNonNull(steelGrade, "steelGrade must not be null");
    }
}
