package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CropRequirement {
    String crop;

    // kg/ha (N, P2O5, K2O)
    double nitrogenKgHa;
    double phosphateKgHa;
    double potassiumKgHa;

    public double requirement(Nutrient nutrient) {
        return switch (nutrient) {
            case N -> nitrogenKgHa;
            case P2O5 -> phosphateKgHa;
            case K2O -> potassiumKgHa;
        };
    }
}
