package com.agro.fertilizer.exception;

import lombok.Getter;

/**
 * The LP solve ended in anything other than OPTIMAL (INFEASIBLE, UNBOUNDED,
 * ABNORMAL, NOT_SOLVED, or the solver backend could not be created).
 */
@Getter
public class SolverNonOptimalException extends BlendingException {

    private final String status;

    public SolverNonOptimalException(String status) {
        super("Solver finished with status " + status);
        this.status = status;
    }

    @Override
    public String getErrorCode() {
        return "SOLVER_NON_OPTIMAL";
    }
}
