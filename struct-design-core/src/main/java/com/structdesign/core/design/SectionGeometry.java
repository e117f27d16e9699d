package com.structdesign.core.design;

import com.structdesign.core.exception.InvalidDesignInputException;
import com.structdesign.core.model.DesignInput;
import com.structdesign.core.model.ElementKind;

import java.util.Objects;

/**
 * Rectangular cross-section with its effective depths.
 *
 * <p>{@code d = h − cover − stirrup − db/2} and {@code d′ = cover + stirrup + db/2}. Slabs are
 * designed on a 1000 mm strip without stirrups.
 *
 * @param kind element kind
 * @param width design width b (mm)
 * @param height overall depth h (mm)
 * @param clearCover clear cover (mm)
 * @param stirrupDiameter stirrup or tie diameter (mm), 0 for slabs
 * @param barDiameter main bar diameter (mm)
 * @param effectiveDepth d (mm)
 * @param compressionSteelDepth d′ (mm)
 */
public record SectionGeometry(
    ElementKind kind,
    double width,
    double height,
    double clearCover,
    int stirrupDiameter,
    int barDiameter,
    double effectiveDepth,
    double compressionSteelDepth
) {
    /** Width of the strip a slab is designed on (mm). */
    public static final double SLAB_STRIP_WIDTH = 1000.0;

    /**
     * Compact constructor with validation.
     */
    public SectionGeometry {
        Objects.requireNonNull(kind, "kind must not be null");
        if (!(effectiveDepth > 0)) {
            throw new InvalidDesignInputException("geometry.clearCover",
                "leaves no effective depth (h=" + height + ", cover=" + clearCover + ", d=" + effectiveDepth + ")");
        }
    }

    /**
     * Derives the section of an input using the bar and stirrup its element kind assumes.
     *
     * @param input design input
     * @return section geometry
     * @throws InvalidDesignInputException if the cover leaves no positive effective depth
     */
    public static SectionGeometry of(DesignInput input) {
        ElementKind kind = input.elementKind();
        double width = kind == ElementKind.SLAB ? SLAB_STRIP_WIDTH : input.geometry().width();
        return of(kind, width, input.geometry().height(), input.geometry().clearCover(),
            kind.stirrupDiameter(), kind.assumedBarDiameter());
    }

    /**
     * Builds a section from explicit dimensions and bar sizes.
     */
    public static SectionGeometry of(ElementKind kind, double width, double height, double clearCover,
                                     int stirrupDiameter, int barDiameter) {
        double toBarCentre = clearCover + stirrupDiameter + barDiameter / 2.0;
        return new SectionGeometry(kind, width, height, clearCover, stirrupDiameter, barDiameter,
            height - toBarCentre, toBarCentre);
    }

    /**
     * Recomputes the depths for the bars actually selected.
     *
     * @param newStirrupDiameter selected stirrup diameter (mm), 0 when none
     * @param newBarDiameter selected main bar diameter (mm)
     * @return section with updated depths
     */
    public SectionGeometry withBars(int newStirrupDiameter, int newBarDiameter) {
        return of(kind, width, height, clearCover, newStirrupDiameter, newBarDiameter);
    }

    /**
     * Whether the given bars still leave a positive effective depth.
     */
    public boolean fits(int newStirrupDiameter, int newBarDiameter) {
        return height - (clearCover + newStirrupDiameter + newBarDiameter / 2.0) > 0;
    }

    public double grossArea() {
        return width * height;
    }

    public double perimeter() {
        return 2.0 * (width + height);
    }

    public double leastDimension() {
        return Math.min(width, height);
    }

    /**
     * Gross moment of inertia {@code b·h³/12}.
     *
     * @return Ig (mm⁴)
     */
    public double grossInertia() {
        return width * Math.pow(height, 3) / 12.0;
    }

    /**
     * Lever arm between tension and compression steel.
     *
     * @return {@code d − d′} (mm), may be zero or negative for very shallow sections
     */
    public double steelLeverArm() {
        return effectiveDepth - compressionSteelDepth;
    }
}
