package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unfactored actions on the element, in kN/m for line members (kN/m² for slabs, read per
 * metre strip).
 *
 * <p>Factored demand is supplied separately in {@link DesignForces}; dead and live load are used
 * only to derive the service moment for deflection when present.
 *
 * @param dead dead load
 * @param live live load
 * @param wind wind load
 * @param seismic seismic load
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceLoads(
    @JsonProperty("dead") double dead,
    @JsonProperty("live") double live,
    @JsonProperty("wind") double wind,
    @JsonProperty("seismic") double seismic
) {
    private static final ServiceLoads NONE = new ServiceLoads(0, 0, 0, 0);

    public static ServiceLoads none() {
        return NONE;
    }

    /**
     * Sustained plus live gravity load used for service-level deflection.
     *
     * @return dead + live
     */
    public double gravity() {
        return dead + live;
    }
}
