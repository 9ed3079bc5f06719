package com.motaz.uptake.core.exception;

public class UptakeException extends RuntimeException {

    public UptakeException(String message) {
        super(message);
    }

    public UptakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
