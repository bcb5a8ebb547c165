package com.agro.fertilizer.domain;

import lombok.Value;

/**
 * Dose of one product on one field, in kg/ha.
 */
@Value
public class DoseAssignment {
    String fieldId;
    String productId;
    double doseKgHa;
}
