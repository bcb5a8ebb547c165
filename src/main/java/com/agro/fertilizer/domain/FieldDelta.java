package com.agro.fertilizer.domain;

import lombok.Value;

/**
 * Total kg/ha on one field in scenario A and B.
 */
@Value
public class FieldDelta {
    String fieldId;
    double totalA;
    double totalB;

    public double getDifference() {
        return totalB - totalA;
    }
}
