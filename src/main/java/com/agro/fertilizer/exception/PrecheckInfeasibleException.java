package com.agro.fertilizer.exception;

import java.util.List;

public class PrecheckInfeasibleException extends BlendingException {

    private final List<String> diagnostics;

    public PrecheckInfeasibleException(List<String> diagnostics) {
        super("Configuration rejected before solving (" + diagnostics.size() + " issue(s)): "
                + String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public List<String> getDetails() {
        return diagnostics;
    }

    @Override
    public String getErrorCode() {
        return "PRECHECK_INFEASIBLE";
    }
}
