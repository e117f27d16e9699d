package com.structdesign.core.design;

import com.structdesign.core.config.DesignSettings.CostRates;
import com.structdesign.core.model.CostBreakdown;
import com.structdesign.core.model.CostEstimate;
import com.structdesign.core.model.Materials;
import com.structdesign.core.model.Reinforcement;
import com.structdesign.core.model.StirrupDetail;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Quantities and itemised cost of one element.
 *
 * <p>Concrete volume {@code b·h·L}, steel weight from bar areas times length at 7850 kg/m³,
 * formwork on the contact area {@code 2·(b + h)·L}, labor per m³ of concrete and per kg of steel,
 * and a fixed overhead multiplier on the construction cost.
 */
public final class CostEstimator {

    /** Steel density (kg/dm³). */
    static final double STEEL_DENSITY = 7.85;

    /** Length used when the element has no span (mm). */
    public static final double UNIT_LENGTH = 1000.0;

    private CostEstimator() {
        // Utility class
    }

    /**
     * Estimates the cost of an element.
     *
     * @param section section geometry
     * @param materials material strengths
     * @param reinforcement selected reinforcement
     * @param length member length (mm)
     * @param rates unit prices
     * @return cost estimate
     */
    public static CostEstimate estimate(SectionGeometry section, Materials materials, Reinforcement reinforcement,
                                        double length, CostRates rates) {
        double b = section.width();
        double h = section.height();

        double volume = b * h * length / 1e9;
        double steelWeight = steelWeight(section, reinforcement, length);
        double contactArea = 2.0 * (b + h) * length / 1e6;

        double concrete = volume * rates.concretePrice(materials.fc());
        double steel = steelWeight * rates.steel();
        double formwork = contactArea * rates.formwork();
        double labor = volume * rates.laborConcrete() + steelWeight * rates.laborSteel();

        double materialCost = concrete + steel + formwork;
        double constructionCost = materialCost + labor;
        double total = constructionCost * rates.overheadFactor();

        CostBreakdown breakdown = new CostBreakdown(
            round(volume > 0 ? steelWeight / volume : 0.0, 1),
            Math.round(materialCost),
            Math.round(constructionCost),
            round(volume, 3),
            round(steelWeight, 1),
            round(contactArea, 1)
        );
        return new CostEstimate(rates.currency(), Math.round(concrete), Math.round(steel), Math.round(formwork),
            Math.round(labor), Math.round(total), breakdown);
    }

    /**
     * Weight of main, compression and transverse steel over the member length.
     *
     * <p>Each stirrup is a closed hoop around the core inside the clear cover.
     *
     * @param section section geometry
     * @param reinforcement selected reinforcement
     * @param length member length (mm)
     * @return steel weight (kg)
     */
    public static double steelWeight(SectionGeometry section, Reinforcement reinforcement, double length) {
        double longitudinal = (reinforcement.main().providedArea() + reinforcement.compressionArea()) * length;

        double transverse = 0.0;
        StirrupDetail stirrups = reinforcement.shear();
        if (stirrups.present()) {
            double cover = section.clearCover();
            double hoopLength = 2.0 * (Math.max(0.0, section.width() - 2 * cover)
                + Math.max(0.0, section.height() - 2 * cover));
            double count = Math.floor(length / stirrups.spacing()) + 1;
            transverse = count * hoopLength * BarCatalog.area(stirrups.diameter());
        }
        return (longitudinal + transverse) / 1e6 * STEEL_DENSITY;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
