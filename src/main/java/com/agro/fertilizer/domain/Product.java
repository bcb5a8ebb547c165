package com.agro.fertilizer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A purchasable fertilizer. Nutrient contents are percent by weight (0-100),
 * price is per tonne and dose bounds are kg/ha.
 */
@Value
@Builder
@Jacksonized
public class Product {

    /**
     * Upper dose used when the table leaves it blank. Reported as "unbounded",
     * but the solver needs a finite number.
     */
    public static final double UNBOUNDED_DOSE = 1e9;

    String id;

    double nitrogenPct;
    double phosphatePct;
    double potassiumPct;

    double pricePerTonne;

    @Builder.Default
    double doseMin = 0.0;

    @Builder.Default
    double doseMax = UNBOUNDED_DOSE;

    public double percent(Nutrient nutrient) {
        return switch (nutrient) {
            case N -> nitrogenPct;
            case P2O5 -> phosphatePct;
            case K2O -> potassiumPct;
        };
    }

    /** Nutrient content as a mass fraction (0.46 for 46%). */
    public double fraction(Nutrient nutrient) {
        return percent(nutrient) / 100.0;
    }

    @JsonIgnore
    public boolean isDoseUnbounded() {
        return doseMax >= UNBOUNDED_DOSE;
    }
}
