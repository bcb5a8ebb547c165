package com.agro.fertilizer.engine;

import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.ScenarioParameters;

public interface BlendingOptimizer {

    /**
     * Solves the minimum-cost blend for every field.
     *
     * @throws com.agro.fertilizer.exception.SolverNonOptimalException if the solve is not OPTIMAL
     * @throws com.agro.fertilizer.exception.SolverTimeoutException    if the time limit stopped the solve
     */
    BlendSolution optimize(BlendInputs inputs, ScenarioParameters params);
}
