package com.motaz.uptake.core.exception;

/**
 * Raised when a percent deviation is needed for a point whose expected value is zero.
 */
public class UndefinedDeviationException extends UptakeException {

    public UndefinedDeviationException(String message) {
        super(message);
    }
}
