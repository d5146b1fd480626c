package com.example.pdftable.domain.model;

import java.util.Locale;

/**
 * Strategy used to turn clustered fragments into table cells.
 */
public enum RowBuildMode {
    /**
     * One cell per fragment, no alignment across rows.
     */
    BASIC,
    /**
     * Cells are mapped onto page-wide inferred columns; fragments sharing a column are merged.
     */
    COLUMN_EXACT;

	/**
	 * Parses a request value into a mode, accepting both {@code COLUMN_EXACT} and {@code column-exact}.
	 *
	 * @param rawValue string coming from the HTTP layer or configuration
	 * @param fallback mode returned when the input is blank or unknown
	 * @return parsed mode or {@code fallback}
	 */
    public static RowBuildMode fromString(String rawValue, RowBuildMode fallback) {
        if (rawValue == null || rawValue.isBlank()) {
            return fallback;
        }
        try {
            return RowBuildMode.valueOf(rawValue.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
