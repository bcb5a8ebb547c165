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

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlendingRequest {
    private List<Field> fields;
    private List<CropRequirement> requirements;
    private List<Product> products;
    private ScenarioParameters params; // defaults when omitted

    public BlendInputs toInputs() {
        return BlendInputs.of(fields, requirements, products);
    }
}
