package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static com.structdesign.core.exception.InvalidDesignInputException.requirePositive;

/**
 * Material strengths of a reinforced concrete element.
 *
 * <p>Values outside the usual code range (for example {@code fc < 17}) are accepted; flagging
 * them is the job of input validation, not of the design engine.
 *
 * @param fc specified concrete compressive strength (MPa)
 * @param fy reinforcement yield strength (MPa)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Materials(
    @JsonProperty("fc") double fc,
    @JsonProperty("fy") double fy
) {
    /**
     * Compact constructor with validation.
     */
    public Materials {
        requirePositive("materials.fc", fc);
        requirePositive("materials.fy", fy);
    }

    /**
     * Concrete grade label, e.g. {@code fc30} or {@code fc41.5}.
     *
     * @return concrete grade label
     */
    public String concreteGrade() {
        return "fc" + label(fc);
    }

    /**
     * Steel grade label, e.g. {@code fy400}.
     *
     * @return steel grade label
     */
    public String steelGrade() {
        return "fy" + label(fy);
    }

    private static String label(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
