package com.motaz.uptake.core.exception;

/**
 * Raised at ingestion when required columns are missing; nothing is written.
 */
public class SchemaValidationException extends UptakeException {

    public SchemaValidationException(String message) {
        super(message);
    }
}
