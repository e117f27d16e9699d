package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import static com.structdesign.core.exception.InvalidDesignInputException.requireNonNegative;
import static com.structdesign.core.exception.InvalidDesignInputException.requirePositive;

/**
 * Rectangular element geometry. All lengths in millimeters.
 *
 * <p>For slabs {@code width} is informational; slabs are designed on a 1000 mm strip and
 * {@code height} is the slab thickness. For columns {@code span} is the column height.
 *
 * @param width section width
 * @param height section height (overall depth)
 * @param span member length, {@code null} when unknown
 * @param clearCover clear cover to the outermost steel
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Geometry(
    @JsonProperty("width") double width,
    @JsonProperty("height") double height,
    @JsonProperty("span") Double span,
    @JsonProperty("clearCover") double clearCover
) {
    /**
     * Compact constructor with validation.
     */
    public Geometry {
        requirePositive("geometry.width", width);
        requirePositive("geometry.height", height);
        requireNonNegative("geometry.clearCover", clearCover);
        if (span != null) {
            requirePositive("geometry.span", span);
        }
    }

    /**
     * Returns the span, or {@code fallback} when the input carries none.
     *
     * @param fallback span to use when unknown (mm)
     * @return span in mm
     */
    public double spanOr(double fallback) {
        return span != null ? span : fallback;
    }
}
