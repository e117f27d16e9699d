package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Structural element kind, carrying the per-variant data that drives the shared design pipeline.
 *
 * <p>Each constant fixes the bar assumed for the first effective-depth estimate, the stirrup (or tie)
 * diameter used before stirrup selection, the practical bar-count range for primary steel, the
 * smallest catalog bar allowed, and which pipeline stages apply.
 */
public enum ElementKind {

    BEAM("beam", 16, 10, 2, 12, 10, true, true),
    COLUMN("column", 19, 10, 4, 20, 16, true, false),
    SLAB("slab", 10, 0, 2, 10, 10, false, true);

    private final String id;
    private final int assumedBarDiameter;
    private final int stirrupDiameter;
    private final int minBarCount;
    private final int maxBarCount;
    private final int minBarDiameter;
    private final boolean hasStirrups;
    private final boolean checksServiceability;

    ElementKind(String id, int assumedBarDiameter, int stirrupDiameter, int minBarCount, int maxBarCount,
                int minBarDiameter, boolean hasStirrups, boolean checksServiceability) {
        this.id = id;
        this.assumedBarDiameter = assumedBarDiameter;
        this.stirrupDiameter = stirrupDiameter;
        this.minBarCount = minBarCount;
        this.maxBarCount = maxBarCount;
        this.minBarDiameter = minBarDiameter;
        this.hasStirrups = hasStirrups;
        this.checksServiceability = checksServiceability;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Main bar diameter (mm) assumed before bars are selected. */
    public int assumedBarDiameter() {
        return assumedBarDiameter;
    }

    /** Stirrup or tie diameter (mm) assumed before stirrups are selected; 0 for slabs. */
    public int stirrupDiameter() {
        return stirrupDiameter;
    }

    public int minBarCount() {
        return minBarCount;
    }

    public int maxBarCount() {
        return maxBarCount;
    }

    public int minBarDiameter() {
        return minBarDiameter;
    }

    public boolean hasStirrups() {
        return hasStirrups;
    }

    public boolean checksServiceability() {
        return checksServiceability;
    }

    /**
     * Resolves an element kind from its id, ignoring case.
     *
     * @param value id such as {@code "beam"}
     * @return matching element kind
     * @throws IllegalArgumentException if no kind matches
     */
    @JsonCreator
    public static ElementKind fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("elementKind must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ElementKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown element kind: " + value + " (expected beam, column or slab)");
    }
}
