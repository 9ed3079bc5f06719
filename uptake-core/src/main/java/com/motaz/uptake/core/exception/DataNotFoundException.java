package com.motaz.uptake.core.exception;

/**
 * Raised when the observation store holds nothing for a cohort.
 */
public class DataNotFoundException extends UptakeException {

    public DataNotFoundException(String message) {
        super(message);
    }
}
