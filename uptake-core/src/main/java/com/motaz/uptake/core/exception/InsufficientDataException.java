package com.motaz.uptake.core.exception;

/**
 * Raised when a series is too short for the forecaster to estimate its seasonal cycle.
 */
public class InsufficientDataException extends UptakeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
