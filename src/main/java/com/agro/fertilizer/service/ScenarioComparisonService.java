package com.agro.fertilizer.service;

import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.FieldDelta;
import com.agro.fertilizer.domain.FieldMixComparison;
import com.agro.fertilizer.domain.ProductDelta;
import com.agro.fertilizer.domain.ScenarioComparison;
import com.agro.fertilizer.domain.ScenarioResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * Compares two finished scenarios. Reads results only.
 */
@Service
public class ScenarioComparisonService {

    public ScenarioComparison compare(ScenarioResult a, ScenarioResult b) {
        Map<String, Map<String, Double>> mixA = dosesByField(a);
        Map<String, Map<String, Double>> mixB = dosesByField(b);

        TreeSet<String> fieldIds = new TreeSet<>(mixA.keySet());
        fieldIds.addAll(mixB.keySet());

        List<FieldDelta> deltas = new ArrayList<>();
        List<FieldMixComparison> mixes = new ArrayList<>();
        for (String id : fieldIds) {
            Map<String, Double> fieldA = mixA.getOrDefault(id, Map.of());
            Map<String, Double> fieldB = mixB.getOrDefault(id, Map.of());
            deltas.add(new FieldDelta(id, total(fieldA), total(fieldB)));
            mixes.add(compareMix(id, fieldA, fieldB));
        }

        return ScenarioComparison.builder()
                .tagA(a.getTag())
                .tagB(b.getTag())
                .costA(a.getTotalCost())
                .costB(b.getTotalCost())
                .costDifference(b.getTotalCost() - a.getTotalCost())
                .fields(deltas)
                .largestIncrease(extreme(deltas, FieldDelta::getDifference, true).orElse(null))
                .largestDecrease(extreme(deltas, FieldDelta::getDifference, false).orElse(null))
                .mixes(mixes)
                .build();
    }

    private FieldMixComparison compareMix(String fieldId, Map<String, Double> fieldA, Map<String, Double> fieldB) {
        TreeSet<String> productIds = new TreeSet<>(fieldA.keySet());
        productIds.addAll(fieldB.keySet());

        List<ProductDelta> products = new ArrayList<>();
        for (String p : productIds) {
            products.add(new ProductDelta(p, fieldA.getOrDefault(p, 0.0), fieldB.getOrDefault(p, 0.0)));
        }

        return FieldMixComparison.builder()
                .fieldId(fieldId)
                .products(products)
                .strongestInA(heaviest(fieldA))
                .strongestInB(heaviest(fieldB))
                .largestIncrease(extreme(products, ProductDelta::getDifference, true).orElse(null))
                .largestDecrease(extreme(products, ProductDelta::getDifference, false).orElse(null))
                .build();
    }

    private static <T> Optional<T> extreme(List<T> items, ToDoubleFunction<T> difference,
                                           boolean increase) {
        if (increase) {
            return items.stream()
                    .filter(d -> difference.applyAsDouble(d) > 0)
                    .max(Comparator.comparingDouble(difference));
        }
        return items.stream()
                .filter(d -> difference.applyAsDouble(d) < 0)
                .min(Comparator.comparingDouble(difference));
    }

    // ties go to the first product id
    private static String heaviest(Map<String, Double> doses) {
        String best = null;
        double bestDose = 0;
        for (Map.Entry<String, Double> e : doses.entrySet()) {
            if (e.getValue() > bestDose) {
                best = e.getKey();
                bestDose = e.getValue();
            }
        }
        return best;
    }

    private static double total(Map<String, Double> doses) {
        return doses.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private Map<String, Map<String, Double>> dosesByField(ScenarioResult result) {
        Map<String, Map<String, Double>> byField = new TreeMap<>();
        for (DoseAssignment d : result.getDoses()) {
            byField.computeIfAbsent(d.getFieldId(), k -> new TreeMap<>())
                    .merge(d.getProductId(), d.getDoseKgHa(), Double::sum);
        }
        return byField;
    }
}
