package com.agro.fertilizer.domain;

import lombok.Value;

/**
 * Dose of one product on one field in scenario A and B, in kg/ha.
 * A product absent from a scenario counts as 0.
 */
@Value
public class ProductDelta {
    String productId;
    double doseA;
    double doseB;

    public double getDifference() {
        return doseB - doseA;
    }
}
