package com.structdesign.core.design;

import com.structdesign.core.model.BarSize;
import com.structdesign.core.model.ElementKind;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.ReinforcementSelection;
import com.structdesign.core.model.ShearDesign;
import com.structdesign.core.model.SpacingLimits;
import com.structdesign.core.model.StirrupDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns required steel areas into constructible bars and stirrups.
 *
 * <p>Main bars come from a full enumeration of the catalog: for each allowed diameter the smallest
 * count covering the area (and the minimum count) is taken, candidates outside the practical count
 * range are dropped, and the cheapest remaining one wins. The cost proxy is steel weight plus a
 * placement charge per bar. Ties go to the smaller diameter.
 */
public final class ReinforcementSelector {

    private static final Logger log = LoggerFactory.getLogger(ReinforcementSelector.class);

    /** Weight factor per mm² of bar area used by the cost proxy. */
    static final double WEIGHT_FACTOR = 0.0078;

    /** Steel price per unit of proxy weight. */
    static final double STEEL_UNIT_COST = 16_500.0;

    /** Placement charge per bar: 0.1 hour of labor at 50 000 per hour. */
    static final double PLACEMENT_COST_PER_BAR = 0.1 * 50_000.0;

    /** Smallest stirrup spacing considered constructible (mm). */
    public static final double MIN_PRACTICAL_SPACING = 75.0;

    /** Longitudinal bar spacing used to derive the minimum column bar count (mm). */
    static final double COLUMN_BAR_SPACING = 150.0;

    /** Largest bar used in slabs (mm). */
    static final int SLAB_MAX_DIAMETER = 16;

    /** Maximum slab bar spacing (mm), also limited to three times the thickness. */
    static final double SLAB_MAX_SPACING = 450.0;

    private ReinforcementSelector() {
        // Utility class
    }

    /**
     * Practical bar-count range and diameter range for a primary steel group.
     *
     * @param minCount minimum bar count
     * @param maxCount maximum bar count
     * @param minDiameter smallest allowed diameter (mm)
     * @param maxDiameter largest allowed diameter (mm)
     */
    public record SelectionRules(int minCount, int maxCount, int minDiameter, int maxDiameter) {

        /**
         * Rules for the main bars of a section.
         *
         * @param section section geometry
         * @return selection rules
         */
        public static SelectionRules forMainBars(SectionGeometry section) {
            ElementKind kind = section.kind();
            return switch (kind) {
                case BEAM -> new SelectionRules(kind.minBarCount(), kind.maxBarCount(), kind.minBarDiameter(),
                    Integer.MAX_VALUE);
                case COLUMN -> {
                    int min = Math.max(kind.minBarCount(), (int) Math.ceil(section.perimeter() / COLUMN_BAR_SPACING));
                    yield new SelectionRules(min, Math.max(min, kind.maxBarCount()), kind.minBarDiameter(),
                        Integer.MAX_VALUE);
                }
                case SLAB -> {
                    double maxSpacing = Math.min(3.0 * section.height(), SLAB_MAX_SPACING);
                    int min = Math.max(kind.minBarCount(), (int) Math.ceil(section.width() / maxSpacing));
                    yield new SelectionRules(min, Math.max(min, kind.maxBarCount()), kind.minBarDiameter(),
                        SLAB_MAX_DIAMETER);
                }
            };
        }

        /**
         * Rules for compression bars of a doubly reinforced section.
         *
         * @return beam rules
         */
        public static SelectionRules forCompressionBars() {
            ElementKind beam = ElementKind.BEAM;
            return new SelectionRules(beam.minBarCount(), beam.maxBarCount(), beam.minBarDiameter(), Integer.MAX_VALUE);
        }

        boolean allows(BarSize bar) {
            return bar.diameter() >= minDiameter && bar.diameter() <= maxDiameter;
        }
    }

    /**
     * Selects main bars for a section.
     *
     * @param requiredArea required steel area (mm²)
     * @param section section geometry
     * @return lowest-cost constructible selection, never zero bars
     */
    public static ReinforcementSelection selectMainBars(double requiredArea, SectionGeometry section) {
        return select(requiredArea, SelectionRules.forMainBars(section));
    }

    /**
     * Selects compression bars of a doubly reinforced section.
     *
     * @param requiredArea required compression steel (mm²)
     * @return lowest-cost constructible selection
     */
    public static ReinforcementSelection selectCompressionBars(double requiredArea) {
        return select(requiredArea, SelectionRules.forCompressionBars());
    }

    /**
     * Enumerates the catalog under the given rules.
     *
     * @param requiredArea required steel area (mm²); zero or negative yields the minimum count
     * @param rules count and diameter ranges
     * @return cheapest candidate, or the largest allowed bar beyond the count range when nothing fits
     */
    public static ReinforcementSelection select(double requiredArea, SelectionRules rules) {
        List<BarSize> allowed = BarCatalog.bars().stream().filter(rules::allows).toList();
        if (allowed.isEmpty()) {
            throw new IllegalStateException("No catalog bar between " + rules.minDiameter() + " and "
                + rules.maxDiameter() + " mm");
        }

        BarSize bestBar = null;
        int bestCount = 0;
        double bestCost = Double.POSITIVE_INFINITY;
        for (BarSize bar : allowed) {
            int count = countFor(requiredArea, bar, rules.minCount());
            if (count > rules.maxCount()) {
                continue;
            }
            double cost = costProxy(bar, count);
            if (cost < bestCost) {
                bestBar = bar;
                bestCount = count;
                bestCost = cost;
            }
        }

        if (bestBar == null) {
            BarSize largest = allowed.get(allowed.size() - 1);
            int count = countFor(requiredArea, largest, rules.minCount());
            log.warn("No bar arrangement within {} to {} bars covers {} mm2; using {}D{}",
                rules.minCount(), rules.maxCount(), Math.round(requiredArea), count, largest.diameter());
            return ReinforcementSelection.of(largest.diameter(), largest.area(), count);
        }

        log.debug("Selected {}D{} for {} mm2", bestCount, bestBar.diameter(), Math.round(requiredArea));
        return ReinforcementSelection.of(bestBar.diameter(), bestBar.area(), bestCount);
    }

    /**
     * Selects stirrups: the smallest diameter whose governing spacing is constructible.
     *
     * <p>When no diameter reaches the practical minimum spacing, the largest one is used and the
     * detail is marked non-constructible.
     *
     * @param shear shear demand
     * @param section section geometry
     * @param materials material strengths
     * @param mainBarDiameter selected main bar diameter (mm)
     * @return stirrup detail with the spacing limits it was derived from
     */
    public static StirrupSelection selectStirrups(ShearDesign shear, SectionGeometry section, Materials materials,
                                                  int mainBarDiameter) {
        List<Integer> diameters = BarCatalog.stirrupDiameters();
        SpacingLimits limits = null;
        int diameter = 0;
        for (int candidate : diameters) {
            diameter = candidate;
            limits = ShearDesigner.spacingLimits(shear, section, materials, candidate, mainBarDiameter);
            if (limits.governing() >= MIN_PRACTICAL_SPACING) {
                return new StirrupSelection(stirrup(diameter, limits.governing(), true), limits);
            }
        }
        log.warn("Stirrup spacing {} mm below the practical minimum of {} mm even with D{} stirrups",
            limits.governing(), MIN_PRACTICAL_SPACING, diameter);
        return new StirrupSelection(stirrup(diameter, limits.governing(), false), limits);
    }

    /**
     * Selected stirrups together with their spacing limits.
     *
     * @param detail stirrup detail
     * @param limits spacing limits for the selected diameter
     */
    public record StirrupSelection(StirrupDetail detail, SpacingLimits limits) {
    }

    static double costProxy(BarSize bar, int count) {
        return count * bar.area() * WEIGHT_FACTOR * STEEL_UNIT_COST + count * PLACEMENT_COST_PER_BAR;
    }

    private static StirrupDetail stirrup(int diameter, double spacing, boolean constructible) {
        double legsArea = ShearDesigner.STIRRUP_LEGS * BarCatalog.area(diameter);
        double areaPerLength = spacing > 0 ? legsArea / spacing : 0.0;
        return new StirrupDetail(diameter, ShearDesigner.STIRRUP_LEGS, spacing, areaPerLength, constructible);
    }

    private static int countFor(double requiredArea, BarSize bar, int minCount) {
        int count = requiredArea > 0 ? (int) Math.ceil(requiredArea / bar.area()) : 0;
        return Math.max(minCount, count);
    }
}
