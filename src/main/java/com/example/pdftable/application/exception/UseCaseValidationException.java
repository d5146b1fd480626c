package com.example.pdftable.application.exception;

/**
 * Signals validation issues detected while running an application use case.
 * Controllers translate it into HTTP 400 unless a more specific subclass is handled.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
