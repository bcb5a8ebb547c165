package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one scenario run: the sparse dose table (only doses above the
 * zero threshold, rounded to 2 decimals) and the total cost recomputed from it.
 */
@Value
@Builder
public class ScenarioResult {
    String tag;
    String status;

    @Singular
    List<DoseAssignment> doses;

    // CLP, rounded to the unit
    long totalCost;

    double objectiveValue;
    long computationTimeMs;
}
