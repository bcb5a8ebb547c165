package com.agro.fertilizer.engine;

import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ScenarioParameters;

/**
 * Cost of applying one kg/ha of a product on a field. Shared by the LP
 * objective and the reported total so that both always agree.
 */
public final class CostModel {

    // Prices are per tonne, doses are kg/ha
    public static final double MASS_UNIT_FACTOR = 1000.0;

    private CostModel() {
    }

    public static double costPerKgHa(Field field, Product product, ScenarioParameters params) {
        double cost = field.getAreaHa() * (product.getPricePerTonne() / MASS_UNIT_FACTOR);
        if (params.hasApplicationCost()) {
            cost += field.getAreaHa() * (params.getApplicationCostPerTonne() / MASS_UNIT_FACTOR);
        }
        return cost;
    }

    public static double cost(Field field, Product product, ScenarioParameters params, double doseKgHa) {
        return doseKgHa * costPerKgHa(field, product, params);
    }
}
