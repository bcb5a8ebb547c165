package com.agro.fertilizer.service;

import com.agro.fertilizer.TestFixtures;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.CropRequirement;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Nutrient;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import com.agro.fertilizer.engine.BlendingOptimizer;
import com.agro.fertilizer.engine.FeasibilityPrechecker;
import com.agro.fertilizer.engine.ResultExtractor;
import com.agro.fertilizer.exception.InvalidInputException;
import com.agro.fertilizer.exception.PrecheckInfeasibleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.agro.fertilizer.TestFixtures.field;
import static com.agro.fertilizer.TestFixtures.product;
import static com.agro.fertilizer.TestFixtures.requirement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class BlendingServiceTest {

    // Rounding each dose to 0.01 kg/ha moves a field total by at most this much
    private static final double ROUNDING_EPS = 0.05;

    private final BlendingService service = TestFixtures.blendingService();

    private static final ScenarioParameters SCENARIO_A = ScenarioParameters.builder()
            .nitrogenCap(300).mixCapacity(600).tolerance(0.02).tag("A").build();

    @Test
    @DisplayName("10 ha corn: 300 kg/ha urea + 170.91 kg/ha MAP")
    void cornFieldEndToEnd() {
        ScenarioResult result = service.runScenario(TestFixtures.cornField(), SCENARIO_A);

        assertThat(result.getDoses()).containsExactly(
                new DoseAssignment("P1", "MAP", 170.91),
                new DoseAssignment("P1", "Urea", 300.0));
        assertThat(result.getTotalCost()).isEqualTo(2_409_642L);
        assertThat(result.getStatus()).isEqualTo("OPTIMAL");
    }

    @Test
    @DisplayName("Nutrients, mix ceiling, N ceiling and dose bounds hold on every field")
    void solutionRespectsAllConstraints() {
        BlendInputs inputs = TestFixtures.farm();

        ScenarioResult result = service.runScenario(inputs, SCENARIO_A);

        Map<String, List<DoseAssignment>> byField = result.getDoses().stream()
                .collect(Collectors.groupingBy(DoseAssignment::getFieldId));
        for (Field field : inputs.getFields()) {
            List<DoseAssignment> doses = byField.getOrDefault(field.getId(), List.of());
            CropRequirement req = inputs.requirementFor(field);

            for (Nutrient nutrient : Nutrient.values()) {
                double supplied = doses.stream()
                        .mapToDouble(d -> d.getDoseKgHa() * inputs.product(d.getProductId()).fraction(nutrient))
                        .sum();
                assertThat(supplied)
                        .as("%s on %s", nutrient, field.getId())
                        .isGreaterThanOrEqualTo(req.requirement(nutrient) * 0.98 - ROUNDING_EPS);
            }

            double mix = doses.stream().mapToDouble(DoseAssignment::getDoseKgHa).sum();
            assertThat(mix).isLessThanOrEqualTo(600 + ROUNDING_EPS);

            double n = doses.stream()
                    .mapToDouble(d -> d.getDoseKgHa() * inputs.product(d.getProductId()).fraction(Nutrient.N))
                    .sum();
            assertThat(n).isLessThanOrEqualTo(300 + ROUNDING_EPS);
        }

        for (DoseAssignment d : result.getDoses()) {
            Product p = inputs.product(d.getProductId());
            assertThat(d.getDoseKgHa()).isBetween(p.getDoseMin() - 0.005, p.getDoseMax() + 0.005);
        }
    }

    @Test
    void reportedCostReconcilesWithTheDoseTable() {
        BlendInputs inputs = TestFixtures.farm();
        ScenarioParameters params = SCENARIO_A.toBuilder().applicationCostPerTonne(15_000).build();

        ScenarioResult result = service.runScenario(inputs, params);

        double recomputed = 0;
        for (DoseAssignment d : result.getDoses()) {
            Field f = inputs.getFields().stream().filter(x -> x.getId().equals(d.getFieldId())).findFirst().orElseThrow();
            Product p = inputs.product(d.getProductId());
            recomputed += d.getDoseKgHa() * f.getAreaHa() * ((p.getPricePerTonne() + 15_000) / 1000.0);
        }
        assertThat(Math.round(recomputed)).isEqualTo(result.getTotalCost());
    }

    @Test
    void sameInputsGiveTheSameCost() {
        ScenarioResult first = service.runScenario(TestFixtures.farm(), SCENARIO_A);
        ScenarioResult second = service.runScenario(TestFixtures.farm(), SCENARIO_A);

        assertThat(second.getTotalCost()).isEqualTo(first.getTotalCost());
    }

    @Test
    @DisplayName("Looser tolerance or ceilings never cost more")
    void relaxingNeverIncreasesCost() {
        ScenarioResult strict = service.runScenario(TestFixtures.farm(), SCENARIO_A);
        ScenarioResult looserTolerance = service.runScenario(TestFixtures.farm(), SCENARIO_A.toBuilder().tolerance(0.10).build());
        ScenarioResult noCeilings = service.runScenario(TestFixtures.farm(),
                SCENARIO_A.toBuilder().nitrogenCap(0).mixCapacity(0).build());

        assertThat(looserTolerance.getObjectiveValue()).isLessThanOrEqualTo(strict.getObjectiveValue() + 1e-6);
        assertThat(noCeilings.getObjectiveValue()).isLessThanOrEqualTo(strict.getObjectiveValue() + 1e-6);
    }

    @Test
    @DisplayName("Precheck failure stops the run before any solve")
    void precheckFailureSkipsTheSolver() {
        BlendingOptimizer optimizer = mock(BlendingOptimizer.class);
        BlendingService isolated = new BlendingService(new FeasibilityPrechecker(), optimizer, new ResultExtractor());
        BlendInputs inputs = BlendInputs.of(
                List.of(field("P1", "Pradera", 5)),
                List.of(requirement("Pradera", 0, 0, 0)),
                List.of(product("A", 20, 0, 0, 1000, 50, 300),
                        product("B", 0, 20, 0, 1000, 80, 300),
                        product("C", 0, 0, 20, 1000, 100, 300)));

        assertThatThrownBy(() -> isolated.runScenario(inputs, ScenarioParameters.builder().mixCapacity(200).build()))
                .isInstanceOf(PrecheckInfeasibleException.class);
        verifyNoInteractions(optimizer);
    }

    @Test
    void scenariosAreIndependent() {
        ScenarioParameters b = ScenarioParameters.builder().nitrogenCap(200).mixCapacity(500).tolerance(0.05).tag("B").build();

        ScenarioResult aAlone = service.runScenario(TestFixtures.farm(), SCENARIO_A);
        service.runScenario(TestFixtures.farm(), b);
        ScenarioResult aAgain = service.runScenario(TestFixtures.farm(), SCENARIO_A);

        assertThat(aAgain.getTotalCost()).isEqualTo(aAlone.getTotalCost());
        assertThat(aAgain.getTag()).isEqualTo("A");
    }

    @Test
    void invalidParametersAreRejected() {
        BlendInputs inputs = TestFixtures.cornField();

        assertThatThrownBy(() -> service.runScenario(inputs, ScenarioParameters.builder().tolerance(1.5).build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.runScenario(inputs, ScenarioParameters.builder().mixCapacity(-1).build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.runScenario(inputs, ScenarioParameters.builder().tag("../x").build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.runScenario(inputs, ScenarioParameters.builder().nitrogenCap(Double.NaN).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("N cap");
        assertThatThrownBy(() -> service.runScenario(inputs, ScenarioParameters.builder().mixCapacity(Double.NaN).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Mix capacity");
        assertThatThrownBy(() -> service.runScenario(inputs,
                ScenarioParameters.builder().applicationCostPerTonne(Double.POSITIVE_INFINITY).build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.runScenario(inputs, null))
                .isInstanceOf(InvalidInputException.class);
    }
}
