package com.motaz.uptake.core.exception;

import java.time.LocalDate;

/**
 * An observation has no forecast point for its date. A correct forecaster
 * never produces this, so callers should treat it as a defect.
 */
public class ForecastAlignmentException extends UptakeException {

    private final LocalDate date;

    public ForecastAlignmentException(LocalDate date) {
        super("No expected value for observation dated " + date);
        this.date = date;
    }

    public LocalDate getDate() {
        return date;
    }
}
