package com.example.pdftable.domain.exception;

/**
 * Base type for input problems detected before any PDF is opened.
 * Mapped to client errors by the interfaces layer.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation shown to the caller
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message explanation shown to the caller
	 * @param cause   original exception that triggered the failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
