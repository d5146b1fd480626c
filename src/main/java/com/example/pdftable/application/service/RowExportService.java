package com.example.pdftable.application.service;

import com.example.pdftable.application.exception.RowExportValidationException;
import com.example.pdftable.application.table.RowSerializer;
import com.example.pdftable.domain.model.TableExtractionResult;
import com.example.pdftable.domain.model.TableRow;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns cached table rows into downloadable serialized lines.
 */
@Service
public class RowExportService {

    /**
     * Runs validation and returns the selected rows in their serialized line form.
     *
     * @param extractionResult cached extraction result stored in the session
     * @param rowIds           row numbers selected by the caller
     * @return newline-terminated serialized rows
     * @throws RowExportValidationException when no rows or IDs are available
     */
    public String exportSelectedRows(TableExtractionResult extractionResult, List<Integer> rowIds) {
        if (extractionResult == null || extractionResult.rows() == null || extractionResult.rows().isEmpty()) {
            throw new RowExportValidationException("No reconstructed rows available for export.");
        }
        if (rowIds == null || rowIds.isEmpty()) {
            throw new RowExportValidationException("Please select at least one row before exporting.");
        }

        List<TableRow> selected = extractionResult.rows().stream()
                .filter(row -> rowIds.contains(row.rowNumber()))
                .toList();
        if (selected.isEmpty()) {
            throw new RowExportValidationException("Selected rows were not found.");
        }

        return RowSerializer.serializeTable(selected) + "\n";
    }
}
