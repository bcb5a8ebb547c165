package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AgronomicSummary {

    public enum MixUsage {
        // Largest field mix below 90% of the ceiling
        WELL_BELOW_LIMIT,
        NEAR_LIMIT,
        ABOVE_LIMIT,
        NO_LIMIT
    }

    String tag;
    List<ProductContribution> products;

    // null when the dose table is empty
    String predominantProduct;

    boolean suppliesNitrogen;
    boolean suppliesPhosphate;
    boolean suppliesPotassium;

    double largestFieldMixKgHa;
    MixUsage mixUsage;
}
