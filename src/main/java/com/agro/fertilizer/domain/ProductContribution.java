package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What one product brings to a scenario's mix, summed over all fields (kg/ha).
 */
@Value
@Builder
public class ProductContribution {
    String productId;
    double doseKgHa;
    double nitrogenKgHa;
    double phosphateKgHa;
    double potassiumKgHa;

    // Share of the summed dose, 0-100
    double mixSharePct;
}
