package com.motaz.uptake.core.exception;

/**
 * Raised at ingestion when a row breaks a data-quality rule; nothing is written.
 */
public class DataQualityException extends UptakeException {

    public DataQualityException(String message) {
        super(message);
    }
}
