package com.example.pdftable.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Application services throw subclasses of this type when a use case cannot run with the given state.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
