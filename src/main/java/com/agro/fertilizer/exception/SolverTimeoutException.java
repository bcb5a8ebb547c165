package com.agro.fertilizer.exception;

import lombok.Getter;

@Getter
public class SolverTimeoutException extends BlendingException {

    private final long timeLimitMs;
    private final String status;

    public SolverTimeoutException(long timeLimitMs, String status) {
        super("Solver hit its time limit of " + timeLimitMs + " ms without an optimal solution (status " + status + ")");
        this.timeLimitMs = timeLimitMs;
        this.status = status;
    }

    @Override
    public String getErrorCode() {
        return "SOLVER_TIMEOUT";
    }
}
