package com.agro.fertilizer.service;

import com.agro.fertilizer.domain.AgronomicSummary;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.Nutrient;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ProductContribution;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Per-product breakdown of a scenario's mix: total dose, nutrient delivered,
 * share of the mix, and how close the fullest field gets to the mix ceiling.
 */
@Service
public class AgronomicSummaryService {

    // Below this many kg/ha a nutrient is considered not supplied
    private static final double SUPPLY_THRESHOLD = 0.5;
    private static final double NEAR_LIMIT_RATIO = 0.9;

    public AgronomicSummary summarize(ScenarioResult result, BlendInputs inputs, ScenarioParameters params) {
        Map<String, Double> doseByProduct = result.getDoses().stream()
                .collect(Collectors.groupingBy(DoseAssignment::getProductId, TreeMap::new,
                        Collectors.summingDouble(DoseAssignment::getDoseKgHa)));
        double totalDose = doseByProduct.values().stream().mapToDouble(Double::doubleValue).sum();

        List<ProductContribution> contributions = new ArrayList<>();
        doseByProduct.forEach((productId, dose) -> {
            Product p = inputs.product(productId);
            contributions.add(ProductContribution.builder()
                    .productId(productId)
                    .doseKgHa(round(dose))
                    .nitrogenKgHa(round(dose * p.fraction(Nutrient.N)))
                    .phosphateKgHa(round(dose * p.fraction(Nutrient.P2O5)))
                    .potassiumKgHa(round(dose * p.fraction(Nutrient.K2O)))
                    .mixSharePct(totalDose > 0 ? round(100.0 * dose / totalDose) : 0.0)
                    .build());
        });

        String predominant = contributions.stream()
                .max(Comparator.comparingDouble(ProductContribution::getMixSharePct))
                .map(ProductContribution::getProductId)
                .orElse(null);

        double largestFieldMix = result.getDoses().stream()
                .collect(Collectors.groupingBy(DoseAssignment::getFieldId,
                        Collectors.summingDouble(DoseAssignment::getDoseKgHa)))
                .values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);

        return AgronomicSummary.builder()
                .tag(result.getTag())
                .products(contributions)
                .predominantProduct(predominant)
                .suppliesNitrogen(contributions.stream().mapToDouble(ProductContribution::getNitrogenKgHa).sum() > SUPPLY_THRESHOLD)
                .suppliesPhosphate(contributions.stream().mapToDouble(ProductContribution::getPhosphateKgHa).sum() > SUPPLY_THRESHOLD)
                .suppliesPotassium(contributions.stream().mapToDouble(ProductContribution::getPotassiumKgHa).sum() > SUPPLY_THRESHOLD)
                .largestFieldMixKgHa(round(largestFieldMix))
                .mixUsage(mixUsage(largestFieldMix, params))
                .build();
    }

    static AgronomicSummary.MixUsage mixUsage(double largestFieldMix, ScenarioParameters params) {
        if (!params.hasMixCapacity()) {
            return AgronomicSummary.MixUsage.NO_LIMIT;
        }
        if (largestFieldMix < NEAR_LIMIT_RATIO * params.getMixCapacity()) {
            return AgronomicSummary.MixUsage.WELL_BELOW_LIMIT;
        }
        // Rounded doses may overshoot the ceiling by a rounding step
        if (largestFieldMix <= params.getMixCapacity() + 0.01) {
            return AgronomicSummary.MixUsage.NEAR_LIMIT;
        }
        return AgronomicSummary.MixUsage.ABOVE_LIMIT;
    }

    private static double round(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
