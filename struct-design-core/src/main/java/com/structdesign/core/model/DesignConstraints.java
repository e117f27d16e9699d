package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import static com.structdesign.core.exception.InvalidDesignInputException.requirePositive;

/**
 * Optional serviceability constraints. A {@code null} component falls back to configuration.
 *
 * @param deflectionLimit allowable deflection as the denominator N of span/N
 * @param crackWidth allowable crack width (mm)
 * @param exposure exposure class
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesignConstraints(
    @JsonProperty("deflectionLimit") Double deflectionLimit,
    @JsonProperty("crackWidth") Double crackWidth,
    @JsonProperty("exposure") ExposureClass exposure
) {
    private static final DesignConstraints NONE = new DesignConstraints(null, null, null);

    /**
     * Compact constructor with validation.
     */
    public DesignConstraints {
        if (deflectionLimit != null) {
            requirePositive("constraints.deflectionLimit", deflectionLimit);
        }
        if (crackWidth != null) {
            requirePositive("constraints.crackWidth", crackWidth);
        }
    }

    public static DesignConstraints none() {
        return NONE;
    }
}
