package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Product-by-product view of one field across both scenarios.
 */
@Value
@Builder
public class FieldMixComparison {
    String fieldId;

    // sorted by product id
    @Singular
    List<ProductDelta> products;

    // heaviest product in each scenario; null when the scenario applies nothing here
    String strongestInA;
    String strongestInB;

    // null when no product moves in that direction
    ProductDelta largestIncrease;
    ProductDelta largestDecrease;
}
