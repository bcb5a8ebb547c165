package com.agro.fertilizer.engine;

import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns raw solver values into the sparse dose table and its cost.
 * The cost is recomputed from the rounded table, never read from the
 * objective, so the written CSV and summary always reconcile.
 */
@Slf4j
@Component
public class ResultExtractor {

    public static final double ZERO_DOSE_EPSILON = 1e-6;

    public ScenarioResult extract(BlendInputs inputs, ScenarioParameters params, BlendSolution solution) {
        List<DoseAssignment> doses = solution.getAssignments().stream()
                .filter(a -> a.getDoseKgHa() > ZERO_DOSE_EPSILON)
                .map(a -> new DoseAssignment(a.getFieldId(), a.getProductId(), roundDose(a.getDoseKgHa())))
                .sorted(Comparator.comparing(DoseAssignment::getFieldId).thenComparing(DoseAssignment::getProductId))
                .collect(Collectors.toList());

        long totalCost = totalCost(inputs, params, doses);
        log.info("Scenario {}: {} non-zero doses, total cost {}", params.getTag(), doses.size(), totalCost);

        return ScenarioResult.builder()
                .tag(params.getTag())
                .status(solution.getStatus())
                .doses(doses)
                .totalCost(totalCost)
                .objectiveValue(solution.getObjectiveValue())
                .computationTimeMs(solution.getComputationTimeMs())
                .build();
    }

    /**
     * Sum of dose * area * price-term over a dose table, rounded half-up to the unit.
     */
    public static long totalCost(BlendInputs inputs, ScenarioParameters params, List<DoseAssignment> doses) {
        double cost = 0;
        for (DoseAssignment d : doses) {
            cost += CostModel.cost(inputs.field(d.getFieldId()), inputs.product(d.getProductId()), params, d.getDoseKgHa());
        }
        return Math.round(cost);
    }

    static double roundDose(double dose) {
        return BigDecimal.valueOf(dose).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
