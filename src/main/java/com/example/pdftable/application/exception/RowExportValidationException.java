package com.example.pdftable.application.exception;

/**
 * Thrown when cached table rows cannot be exported, e.g. nothing was extracted yet or no row was selected.
 */
public class RowExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public RowExportValidationException(String message) {
        super(message);
    }
}
