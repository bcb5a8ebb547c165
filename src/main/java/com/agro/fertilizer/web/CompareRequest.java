package com.agro.fertilizer.web;

import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.CropRequirement;
import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ScenarioParameters;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Same tables, two parameter sets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {
    private List<Field> fields;
    private List<CropRequirement> requirements;
    private List<Product> products;
    private ScenarioParameters scenarioA;
    private ScenarioParameters scenarioB;

    public BlendInputs toInputs() {
        return BlendInputs.of(fields, requirements, products);
    }
}
