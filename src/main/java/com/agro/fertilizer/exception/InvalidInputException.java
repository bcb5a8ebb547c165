package com.agro.fertilizer.exception;

/**
 * Input that cannot be coerced leniently: unreadable file, empty table,
 * non-positive area, inverted dose bounds, out-of-range parameters.
 */
public class InvalidInputException extends BlendingException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_INPUT";
    }
}
