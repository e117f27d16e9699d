package com.structdesign.core.model;

/**
 * Quantities and subtotals behind a {@link CostEstimate}.
 *
 * @param steelRatio steel weight per concrete volume (kg/m³), one decimal
 * @param materialCost concrete + steel + formwork, whole units
 * @param constructionCost material cost + labor, whole units
 * @param volume concrete volume (m³), three decimals
 * @param steelWeight steel weight including stirrups (kg), one decimal
 * @param contactArea formwork contact area (m²), one decimal
 */
public record CostBreakdown(
    double steelRatio,
    long materialCost,
    long constructionCost,
    double volume,
    double steelWeight,
    double contactArea
) {
}
