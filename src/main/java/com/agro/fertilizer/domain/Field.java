package com.agro.fertilizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A management unit ("potrero"): one row of the fields table.
 */
@Value
@Builder
@Jacksonized
public class Field {
    String id;
    String crop;

    // Hectares, always > 0
    double areaHa;
}
