package com.example.pdftable.infrastructure.exception;

/**
 * Base unchecked exception for failures raised while talking to PDFBox or the filesystem.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
