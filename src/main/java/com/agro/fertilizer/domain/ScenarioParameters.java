package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One complete parameter set run through the pipeline. Passed by value; the
 * pipeline never reads parameters from anywhere else.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScenarioParameters {

    public static final double DEFAULT_TOLERANCE = 0.02;

    // Per-field N ceiling in kg/ha, 0 = disabled
    double nitrogenCap;

    // Per-field total mix ceiling in kg/ha, 0 = disabled
    double mixCapacity;

    // Fraction of each requirement that may be left unmet
    @Builder.Default
    double tolerance = DEFAULT_TOLERANCE;

    // Cost per tonne applied, 0 = not charged
    double applicationCostPerTonne;

    @Builder.Default
    String tag = "A";

    public boolean hasNitrogenCap() {
        return nitrogenCap > 0;
    }

    public boolean hasMixCapacity() {
        return mixCapacity > 0;
    }

    public boolean hasApplicationCost() {
        return applicationCostPerTonne > 0;
    }

    public double effectiveRequirement(double requirement) {
        return requirement * (1.0 - tolerance);
    }

    public static ScenarioParameters defaults() {
        return ScenarioParameters.builder().build();
    }
}
