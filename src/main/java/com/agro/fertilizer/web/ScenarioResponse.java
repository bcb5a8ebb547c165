package com.agro.fertilizer.web;

import com.agro.fertilizer.domain.AgronomicSummary;
import com.agro.fertilizer.domain.ScenarioResult;
import lombok.Value;

@Value
public class ScenarioResponse {
    ScenarioResult result;
    AgronomicSummary summary;
}
