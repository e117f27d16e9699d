package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Environmental exposure, ordered from mild to extreme.
 *
 * <p>Each class carries the minimum clear cover (mm) and the permissible crack width (mm).
 */
public enum ExposureClass {

    MILD("mild", 20, 0.40),
    MODERATE("moderate", 25, 0.33),
    SEVERE("severe", 40, 0.25),
    VERY_SEVERE("very_severe", 50, 0.20),
    EXTREME("extreme", 75, 0.10);

    private final String id;
    private final int minimumCover;
    private final double crackWidthLimit;

    ExposureClass(String id, int minimumCover, double crackWidthLimit) {
        this.id = id;
        this.minimumCover = minimumCover;
        this.crackWidthLimit = crackWidthLimit;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public int minimumCover() {
        return minimumCover;
    }

    public double crackWidthLimit() {
        return crackWidthLimit;
    }

    @JsonCreator
    public static ExposureClass fromId(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ExposureClass exposure : values()) {
            if (exposure.id.equals(normalized)) {
                return exposure;
            }
        }
        throw new IllegalArgumentException("Unknown exposure class: " + value);
    }
}
