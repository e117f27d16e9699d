package com.structdesign.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunables of the design engine, loaded from {@code structdesign.yaml}.
 *
 * <p>Missing sections and missing keys fall back to the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * serviceability:
 *   deflectionLimit: 360
 *   crackWidthLimit: 0.33
 *   serviceMomentFactor: 1.4
 *   defaultSpan: 6000
 *
 * cost:
 *   currency: IDR
 *   concreteStandard: 950000
 *   concreteHighStrength: 1050000
 *   highStrengthThreshold: 35
 *   steel: 16800
 *   formwork: 120000
 *   laborConcrete: 280000
 *   laborSteel: 8500
 *   overheadFactor: 1.18
 * }</pre>
 *
 * @param serviceability serviceability defaults
 * @param cost unit prices
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignSettings(
    @JsonProperty("serviceability") ServiceabilitySettings serviceability,
    @JsonProperty("cost") CostRates cost
) {
    private static final DesignSettings DEFAULTS = new DesignSettings(null, null);

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public DesignSettings {
        if (serviceability == null) {
            serviceability = ServiceabilitySettings.defaults();
        }
        if (cost == null) {
            cost = CostRates.defaults();
        }
    }

    /**
     * Creates the default settings.
     *
     * @return default settings
     */
    public static DesignSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Serviceability defaults used when the input carries no constraint.
     *
     * @param deflectionLimit denominator N of the span/N deflection limit
     * @param crackWidthLimit allowable crack width (mm)
     * @param serviceMomentFactor ratio of factored to service moment when no service loads are given
     * @param defaultSpan span (mm) assumed for beams and slabs without one
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ServiceabilitySettings(
        @JsonProperty("deflectionLimit") Double deflectionLimit,
        @JsonProperty("crackWidthLimit") Double crackWidthLimit,
        @JsonProperty("serviceMomentFactor") Double serviceMomentFactor,
        @JsonProperty("defaultSpan") Double defaultSpan
    ) {
        public ServiceabilitySettings {
            deflectionLimit = positiveOr(deflectionLimit, 360.0, "serviceability.deflectionLimit");
            crackWidthLimit = positiveOr(crackWidthLimit, 0.33, "serviceability.crackWidthLimit");
            serviceMomentFactor = positiveOr(serviceMomentFactor, 1.4, "serviceability.serviceMomentFactor");
            defaultSpan = positiveOr(defaultSpan, 6000.0, "serviceability.defaultSpan");
        }

        public static ServiceabilitySettings defaults() {
            return new ServiceabilitySettings(null, null, null, null);
        }
    }

    /**
     * Unit prices for the cost estimate.
     *
     * @param currency currency code
     * @param concreteStandard concrete price per m³ below the high-strength threshold
     * @param concreteHighStrength concrete price per m³ at or above the threshold
     * @param highStrengthThreshold fc (MPa) from which the high-strength price applies
     * @param steel reinforcing steel price per kg
     * @param formwork formwork price per m² contact area
     * @param laborConcrete concrete labor per m³
     * @param laborSteel steel fixing labor per kg
     * @param overheadFactor multiplier applied to the construction cost
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CostRates(
        @JsonProperty("currency") String currency,
        @JsonProperty("concreteStandard") Double concreteStandard,
        @JsonProperty("concreteHighStrength") Double concreteHighStrength,
        @JsonProperty("highStrengthThreshold") Double highStrengthThreshold,
        @JsonProperty("steel") Double steel,
        @JsonProperty("formwork") Double formwork,
        @JsonProperty("laborConcrete") Double laborConcrete,
        @JsonProperty("laborSteel") Double laborSteel,
        @JsonProperty("overheadFactor") Double overheadFactor
    ) {
        public CostRates {
            if (currency == null || currency.isBlank()) {
                currency = "IDR";
            }
            concreteStandard = positiveOr(concreteStandard, 950_000.0, "cost.concreteStandard");
            concreteHighStrength = positiveOr(concreteHighStrength, 1_050_000.0, "cost.concreteHighStrength");
            highStrengthThreshold = positiveOr(highStrengthThreshold, 35.0, "cost.highStrengthThreshold");
            steel = positiveOr(steel, 16_800.0, "cost.steel");
            formwork = positiveOr(formwork, 120_000.0, "cost.formwork");
            laborConcrete = positiveOr(laborConcrete, 280_000.0, "cost.laborConcrete");
            laborSteel = positiveOr(laborSteel, 8_500.0, "cost.laborSteel");
            overheadFactor = positiveOr(overheadFactor, 1.18, "cost.overheadFactor");
        }

        public static CostRates defaults() {
            return new CostRates(null, null, null, null, null, null, null, null, null);
        }

        /**
         * Concrete price per m³ for the given strength.
         *
         * @param fc concrete strength (MPa)
         * @return unit price
         */
        public double concretePrice(double fc) {
            return fc >= highStrengthThreshold ? concreteHighStrength : concreteStandard;
        }
    }

    private static Double positiveOr(Double value, double fallback, String key) {
        if (value == null) {
            return fallback;
        }
        if (!(value > 0)) {
            throw new IllegalArgumentException(key + " must be > 0 but was " + value);
        }
        return value;
    }
}
