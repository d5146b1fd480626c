package com.example.pdftable.infrastructure.exception;

/**
 * Signals that a PDF could not be read from disk or loaded from memory.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox or IO exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
