package com.agro.fertilizer.web;

import com.agro.fertilizer.domain.ScenarioComparison;
import lombok.Value;

@Value
public class ComparisonResponse {
    ScenarioResponse scenarioA;
    ScenarioResponse scenarioB;
    ScenarioComparison comparison;
}
