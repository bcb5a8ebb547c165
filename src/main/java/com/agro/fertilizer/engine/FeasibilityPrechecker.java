package com.agro.fertilizer.engine;

import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.CropRequirement;
import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Nutrient;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.exception.PrecheckInfeasibleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Cheap per-field bound analysis run before the LP.
 * <p>
 * Each nutrient is bounded on its own (sum of max dose times content, tightened
 * to "mix capacity filled with the richest product", clamped by the N cap).
 * The bounds are decoupled, so a configuration the LP could still satisfy may
 * be rejected for odd product mixes. Whatever is rejected here is never
 * sent to the solver.
 */
@Slf4j
@Component
public class FeasibilityPrechecker {

    // Absorbs float noise in "requirement > bound" comparisons
    private static final double EPS = 1e-9;

    /**
     * @return all diagnostics, empty when nothing was found
     */
    public List<String> diagnose(BlendInputs inputs, ScenarioParameters params) {
        Collection<Product> products = inputs.getProducts().values();
        List<String> diagnostics = new ArrayList<>();

        for (Field field : inputs.getFields()) {
            CropRequirement req = inputs.requirementFor(field);
            for (Nutrient nutrient : Nutrient.values()) {
                double required = params.effectiveRequirement(req.requirement(nutrient));
                double bound = deliverableBound(products, nutrient, params);
                if (required > bound + EPS) {
                    diagnostics.add(String.format(Locale.ROOT,
                            "Field %s: %s required %.2f kg/ha > %s maximum reachable %.2f kg/ha (%s)",
                            field.getId(), nutrient.label(), required, nutrient.label(), bound,
                            limitingFactor(products, nutrient, params)));
                }
            }
        }

        if (params.hasMixCapacity()) {
            double minimums = products.stream().mapToDouble(Product::getDoseMin).sum();
            if (minimums > params.getMixCapacity() + EPS) {
                diagnostics.add(String.format(Locale.ROOT,
                        "Sum of minimum doses %.2f kg/ha exceeds mix capacity %.2f kg/ha",
                        minimums, params.getMixCapacity()));
            }
        }
        return diagnostics;
    }

    /**
     * @throws PrecheckInfeasibleException carrying every diagnostic found
     */
    public void check(BlendInputs inputs, ScenarioParameters params) {
        List<String> diagnostics = diagnose(inputs, params);
        if (!diagnostics.isEmpty()) {
            log.warn("Precheck rejected scenario {}: {}", params.getTag(), diagnostics);
            throw new PrecheckInfeasibleException(diagnostics);
        }
        log.info("Precheck passed for scenario {} ({} fields, {} products)",
                params.getTag(), inputs.getFields().size(), inputs.getProducts().size());
    }

    /**
     * Optimistic upper bound on the kg/ha of one nutrient a field can receive.
     */
    double deliverableBound(Collection<Product> products, Nutrient nutrient, ScenarioParameters params) {
        double bound = products.stream()
                .mapToDouble(p -> p.getDoseMax() * p.fraction(nutrient))
                .sum();

        if (params.hasMixCapacity()) {
            double richest = bestFraction(products, nutrient);
            bound = Math.min(bound, params.getMixCapacity() * richest);
        }
        if (nutrient == Nutrient.N && params.hasNitrogenCap()) {
            bound = Math.min(bound, params.getNitrogenCap());
        }
        return bound;
    }

    private double bestFraction(Collection<Product> products, Nutrient nutrient) {
        return products.stream().mapToDouble(p -> p.fraction(nutrient)).max().orElse(0.0);
    }

    private String limitingFactor(Collection<Product> products, Nutrient nutrient, ScenarioParameters params) {
        double richest = bestFraction(products, nutrient);
        if (richest <= 0) {
            return "no product contains " + nutrient.label();
        }
        // deliverableBound returns one of its candidates unchanged, so equality is exact
        double bound = deliverableBound(products, nutrient, params);
        if (nutrient == Nutrient.N && params.hasNitrogenCap() && bound == params.getNitrogenCap()) {
            return "N cap";
        }
        if (params.hasMixCapacity() && bound == params.getMixCapacity() * richest) {
            return "mix capacity";
        }
        return "maximum doses";
    }
}
