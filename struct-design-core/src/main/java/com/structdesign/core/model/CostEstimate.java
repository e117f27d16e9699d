package com.structdesign.core.model;

import java.util.Objects;

/**
 * Itemised cost of one element, in whole currency units.
 *
 * @param currency currency code of the unit prices
 * @param concrete concrete material cost
 * @param steel reinforcing steel cost
 * @param formwork formwork cost
 * @param labor concrete and steel labor
 * @param total construction cost with overhead
 * @param breakdown quantities and subtotals
 */
public record CostEstimate(
    String currency,
    long concrete,
    long steel,
    long formwork,
    long labor,
    long total,
    CostBreakdown breakdown
) {
    /**
     * Compact constructor with validation.
     */
    public CostEstimate {
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(breakdown, "breakdown must not be null");
    }
}
