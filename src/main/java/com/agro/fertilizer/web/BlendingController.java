package com.agro.fertilizer.web;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import com.agro.fertilizer.exception.InvalidInputException;
import com.agro.fertilizer.service.AgronomicSummaryService;
import com.agro.fertilizer.service.BlendingService;
import com.agro.fertilizer.service.ScenarioComparisonService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/optimize")
@RequiredArgsConstructor
public class BlendingController {

    private final BlendingService blendingService;
    private final AgronomicSummaryService summaryService;
    private final ScenarioComparisonService comparisonService;
    private final FertilizerProperties properties;

    @PostMapping
    public ResponseEntity<ScenarioResponse> optimize(@RequestBody BlendingRequest request) {
        BlendInputs inputs = request.toInputs();
        ScenarioParameters params = orDefault(request.getParams(), "A");
        return ResponseEntity.ok(run(inputs, params));
    }

    @PostMapping("/compare")
    public ResponseEntity<ComparisonResponse> compare(@RequestBody CompareRequest request) {
        if (request.getScenarioA() == null || request.getScenarioB() == null) {
            throw new InvalidInputException("Both scenarioA and scenarioB are required");
        }
        BlendInputs inputs = request.toInputs();
        ScenarioResponse a = run(inputs, request.getScenarioA());
        ScenarioResponse b = run(inputs, request.getScenarioB());
        return ResponseEntity.ok(new ComparisonResponse(a, b, comparisonService.compare(a.getResult(), b.getResult())));
    }

    private ScenarioResponse run(BlendInputs inputs, ScenarioParameters params) {
        ScenarioResult result = blendingService.runScenario(inputs, params);
        return new ScenarioResponse(result, summaryService.summarize(result, inputs, params));
    }

    private ScenarioParameters orDefault(ScenarioParameters params, String tag) {
        if (params != null) {
            return params;
        }
        return ScenarioParameters.builder()
                .tolerance(properties.getDefaultTolerance())
                .tag(tag)
                .build();
    }
}
