package com.example.pdftable.domain.exception;

/**
 * Raised when an extraction is requested without an uploaded PDF.
 * Guards the layout reader from null or zero-byte uploads.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to extract tables from.");
    }
}
