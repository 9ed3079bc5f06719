package com.motaz.uptake.api.services;

import com.motaz.uptake.core.exception.UptakeException;

public class UnknownCohortException extends UptakeException {

    public UnknownCohortException(String message) {
        super(message);
    }
}
