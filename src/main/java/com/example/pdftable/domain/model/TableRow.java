package com.example.pdftable.domain.model;

import java.util.List;

/**
 * Domain DTO describing one reconstructed table row.
 * Cells are already cleaned and ordered left to right, so serialization and export remain trivial.
 *
 * @param rowNumber  1-based position of the row across the whole document
 * @param pageNumber 1-based page the row was found on
 * @param cells      ordered cell texts, never empty
 */
public record TableRow(
        int rowNumber,
        int pageNumber,
        List<String> cells
) {

    public TableRow {
        cells = List.copyOf(cells);
    }
}
