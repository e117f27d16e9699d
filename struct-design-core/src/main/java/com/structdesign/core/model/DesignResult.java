package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Complete design of one element: echoed dimensions, required steel, selected reinforcement,
 * checks, and cost. Immutable; suitable for direct JSON serialization.
 *
 * @param id caller label from the input
 * @param element resolved dimensions and grades
 * @param flexure required longitudinal steel
 * @param shear shear demand and stirrup spacing limits
 * @param reinforcement selected bars and stirrups
 * @param checks named capacity and serviceability checks
 * @param cost itemised cost
 * @param valid AND of all check statuses, serialized as {@code isValid}
 * @param notes advisory messages
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesignResult(
    String id,
    ElementSummary element,
    FlexuralDesign flexure,
    ShearDesign shear,
    Reinforcement reinforcement,
    DesignChecks checks,
    CostEstimate cost,
    @JsonProperty("isValid") boolean valid,
    List<String> notes
) {
    /**
     * Compact constructor with validation.
     */
    public DesignResult {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(flexure, "flexure must not be null");
        Objects.requireNonNull(shear, "shear must not be null");
        Objects.requireNonNull(reinforcement, "reinforcement must not be null");
        Objects.requireNonNull(checks, "checks must not be null");
        Objects.requireNonNull(cost, "cost must not be null");
        notes = notes == null ? List.of() : List.copyOf(notes);
        if (valid != checks.allPassed()) {
            throw new IllegalArgumentException("valid must equal the AND of all check statuses");
        }
    }

    /**
     * Builds a result whose validity is derived from the checks.
     */
    public static DesignResult of(String id, ElementSummary element, FlexuralDesign flexure, ShearDesign shear,
                                  Reinforcement reinforcement, DesignChecks checks,
                                  CostEstimate cost, List<String> notes) {
        return new DesignResult(id, element, flexure, shear, reinforcement, checks, cost,
            checks.allPassed(), notes);
    }

    /**
     * One-line description such as {@code beam 300x500: 4D19, stirrups D10-150}.
     *
     * @return summary line
     */
    public String summary() {
        StringBuilder sb = new StringBuilder()
            .append(element.kind().id()).append(' ')
            .append(Math.round(element.width())).append('x').append(Math.round(element.height()))
            .append(": ").append(reinforcement.main().notation());
        if (reinforcement.compression() != null) {
            sb.append(" + ").append(reinforcement.compression().notation()).append(" top");
        }
        if (reinforcement.shear().present()) {
            sb.append(", stirrups ").append(reinforcement.shear().notation());
        }
        return sb.toString();
    }
}
