package com.example.pdftable.infrastructure.exception;

/**
 * Raised when PDFBox fails to produce the layout of a single page.
 * The failure is final for that page; whether the rest of the document is still processed is up to the caller.
 */
public class DocumentLayoutException extends InfrastructureException {

    private final int pageNumber;

	/**
	 * @param pageNumber 1-based page whose layout could not be extracted
	 * @param cause      PDFBox exception
	 */
    public DocumentLayoutException(int pageNumber, Throwable cause) {
        super("Unable to extract the layout of page " + pageNumber + ".", cause);
        this.pageNumber = pageNumber;
    }

    /**
     * @return 1-based page number that failed
     */
    public int getPageNumber() {
        return pageNumber;
    }
}
