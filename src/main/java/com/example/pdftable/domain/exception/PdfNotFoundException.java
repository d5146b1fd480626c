package com.example.pdftable.domain.exception;

/**
 * Raised when a PDF path handed to the table extractor does not exist on disk.
 */
public class PdfNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("PDF not found: " + path);
    }
}
