package com.example.pdftable.domain.model;

import java.util.List;

/**
 * Domain DTO containing the reconstructed table of an uploaded PDF.
 * Returned from {@code PdfTableService} to controllers; fields of features that were not requested are {@code null}.
 */
public record TableExtractionResult(
        String fileName,
        int pageCount,
        RowBuildMode mode,
        List<TableRow> rows,
        List<String> serializedRows,
        List<PageTextBlock> pageBlocks
) {
}
