package com.example.pdftable.domain.exception;

/**
 * Raised when a caller asks for table extraction from a null {@link java.nio.file.Path}.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
