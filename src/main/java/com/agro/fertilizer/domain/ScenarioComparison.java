package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScenarioComparison {
    String tagA;
    String tagB;
    long costA;
    long costB;

    // B - A; positive means B is more expensive
    long costDifference;

    List<FieldDelta> fields;

    // null when no field changes in that direction
    FieldDelta largestIncrease;
    FieldDelta largestDecrease;

    // one entry per field, same order as fields
    List<FieldMixComparison> mixes;
}
