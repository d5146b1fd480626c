package com.example.pdftable.domain.exception;

/**
 * Raised when an upload does not look like a PDF by content type or file name.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
