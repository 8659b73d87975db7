package com.barthel.tariffshock.application.exception;

/**
 * Raised when an evaluation arrives before reference data finished loading.
 */
public class ReferenceDataUnavailableException extends RuntimeException {
    public ReferenceDataUnavailableException(String message) {
        super(message);
    }
}
