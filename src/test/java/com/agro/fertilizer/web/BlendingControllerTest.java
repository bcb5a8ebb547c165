package com.agro.fertilizer.web;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.AgronomicSummary;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.ScenarioComparison;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import com.agro.fertilizer.exception.PrecheckInfeasibleException;
import com.agro.fertilizer.exception.SolverNonOptimalException;
import com.agro.fertilizer.service.AgronomicSummaryService;
import com.agro.fertilizer.service.BlendingService;
import com.agro.fertilizer.service.ScenarioComparisonService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BlendingController.class)
class BlendingControllerTest {

    private static final String TABLES = """
            "fields": [{"id": "P1", "crop": "Maiz", "areaHa": 10}],
            "requirements": [{"crop": "Maiz", "nitrogenKgHa": 160, "phosphateKgHa": 70, "potassiumKgHa": 0}],
            "products": [
              {"id": "Urea", "nitrogenPct": 46, "pricePerTonne": 450000, "doseMax": 300},
              {"id": "MAP", "nitrogenPct": 11, "phosphatePct": 52, "pricePerTonne": 620000, "doseMax": 300}
            ]
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BlendingService blendingService;

    @MockBean
    private AgronomicSummaryService summaryService;

    @MockBean
    private ScenarioComparisonService comparisonService;

    @MockBean
    private FertilizerProperties properties;

    private static ScenarioResult result(String tag, long cost) {
        return ScenarioResult.builder()
                .tag(tag)
                .status("OPTIMAL")
                .dose(new DoseAssignment("P1", "Urea", 300.0))
                .totalCost(cost)
                .build();
    }

    @Test
    void optimizeReturnsDosesAndSummary() throws Exception {
        when(blendingService.runScenario(any(), any())).thenReturn(result("A", 2_409_642L));
        when(summaryService.summarize(any(), any(), any()))
                .thenReturn(AgronomicSummary.builder().tag("A").products(List.of()).predominantProduct("Urea").build());

        mockMvc.perform(post("/api/v1/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + TABLES + ", \"params\": {\"nitrogenCap\": 300, \"mixCapacity\": 600, \"tag\": \"A\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.totalCost").value(2409642))
                .andExpect(jsonPath("$.result.doses[0].productId").value("Urea"))
                .andExpect(jsonPath("$.summary.predominantProduct").value("Urea"));

        ArgumentCaptor<ScenarioParameters> params = ArgumentCaptor.forClass(ScenarioParameters.class);
        verify(blendingService).runScenario(any(), params.capture());
        assertThat(params.getValue().getMixCapacity()).isEqualTo(600.0);
        // tolerance omitted in the body
        assertThat(params.getValue().getTolerance()).isEqualTo(ScenarioParameters.DEFAULT_TOLERANCE);
    }

    @Test
    void precheckFailureIsUnprocessableWithDiagnostics() throws Exception {
        when(blendingService.runScenario(any(), any()))
                .thenThrow(new PrecheckInfeasibleException(List.of("Sum of minimum doses 230.00 kg/ha exceeds mix capacity 200.00 kg/ha")));

        mockMvc.perform(post("/api/v1/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + TABLES + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("PRECHECK_INFEASIBLE"))
                .andExpect(jsonPath("$.details[0]").value("Sum of minimum doses 230.00 kg/ha exceeds mix capacity 200.00 kg/ha"));
    }

    @Test
    void unknownCropIsABadRequest() throws Exception {
        String body = "{" + TABLES.replace("\"crop\": \"Maiz\", \"areaHa\"", "\"crop\": \"Avena\", \"areaHa\"") + "}";

        mockMvc.perform(post("/api/v1/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_CROP"));
        verifyNoInteractions(blendingService);
    }

    @Test
    void compareRunsBothScenarios() throws Exception {
        when(blendingService.runScenario(any(), any()))
                .thenReturn(result("A", 100L))
                .thenReturn(result("B", 80L));
        when(summaryService.summarize(any(), any(), any())).thenReturn(AgronomicSummary.builder().build());
        when(comparisonService.compare(any(), any()))
                .thenReturn(ScenarioComparison.builder().tagA("A").tagB("B").costA(100).costB(80).costDifference(-20).build());

        mockMvc.perform(post("/api/v1/optimize/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + TABLES + ", \"scenarioA\": {\"tag\": \"A\"}, \"scenarioB\": {\"tag\": \"B\", \"tolerance\": 0.1}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenarioA.result.totalCost").value(100))
                .andExpect(jsonPath("$.scenarioB.result.totalCost").value(80))
                .andExpect(jsonPath("$.comparison.costDifference").value(-20));
    }

    @Test
    void solverFailureNamesTheStatus() throws Exception {
        when(blendingService.runScenario(any(), any())).thenThrow(new SolverNonOptimalException("INFEASIBLE"));

        mockMvc.perform(post("/api/v1/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + TABLES + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("SOLVER_NON_OPTIMAL"))
                .andExpect(jsonPath("$.message").value("Solver finished with status INFEASIBLE"));
    }
}
