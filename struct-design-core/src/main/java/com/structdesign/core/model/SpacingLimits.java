package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Every individual limit on stirrup spacing, and the governing (smallest) one.
 *
 * <p>A {@code null} limit does not apply (no strength demand, no detailing rule).
 *
 * @param fromMinimumArea spacing giving the minimum shear steel area (mm)
 * @param fromStrength spacing giving the required steel shear contribution (mm)
 * @param fromDepth d/2, or d/4 under high shear (mm)
 * @param absoluteMaximum absolute spacing cap (mm)
 * @param fromDetailing column tie limit {@code min(16·db, 48·dtie, least dimension)} (mm)
 * @param governing the smallest of all applicable limits (mm)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpacingLimits(
    Double fromMinimumArea,
    Double fromStrength,
    Double fromDepth,
    Double absoluteMaximum,
    Double fromDetailing,
    double governing
) {
}
