package com.agro.fertilizer.exception;

import java.util.List;

/**
 * Root of every failure the blending pipeline reports. All of them are fatal
 * for the scenario: no partial result is produced.
 */
public abstract class BlendingException extends RuntimeException {

    protected BlendingException(String message) {
        super(message);
    }

    protected BlendingException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-friendly error kind, e.g. "MISSING_COLUMN". */
    public abstract String getErrorCode();

    /** Extra lines of diagnostics. Empty unless the error carries a list. */
    public List<String> getDetails() {
        return List.of();
    }
}
