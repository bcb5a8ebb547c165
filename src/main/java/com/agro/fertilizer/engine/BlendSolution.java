package com.agro.fertilizer.engine;

import com.agro.fertilizer.domain.DoseAssignment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Raw values of every decision variable after an optimal solve, copied out of
 * the solver so that the native model can be released.
 */
@Value
@Builder
public class BlendSolution {
    String status;

    // One entry per (field, product) pair, unfiltered and unrounded
    @Singular
    List<DoseAssignment> assignments;

    double objectiveValue;
    long computationTimeMs;
}
