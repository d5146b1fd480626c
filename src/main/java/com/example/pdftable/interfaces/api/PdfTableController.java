package com.example.pdftable.interfaces.api;

import com.example.pdftable.application.service.PdfTableService;
import com.example.pdftable.application.service.RowExportService;
import com.example.pdftable.domain.model.ExtractionFeature;
import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TableExtractionResult;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;

/**
 * Interfaces-layer controller exposing table extraction for uploaded PDFs and export of the cached rows.
 */
@RestController
public class PdfTableController {

    private static final String SESSION_RESULT_KEY = "LATEST_TABLE_RESULT";

    private final PdfTableService pdfTableService;
    private final RowExportService rowExportService;

    /**
     * @param pdfTableService  service responsible for reconstructing tables
     * @param rowExportService service responsible for exporting selected rows
     */
    public PdfTableController(PdfTableService pdfTableService, RowExportService rowExportService) {
        this.pdfTableService = pdfTableService;
        this.rowExportService = rowExportService;
    }

    /**
     * Reconstructs the table of an uploaded PDF and caches the result in the session for later export.
     *
     * @param file          uploaded PDF
     * @param modeParam     {@code basic} or {@code column-exact}; unknown values use the configured default
     * @param featureParams requested feature list (optional)
     * @param session       HTTP session caching the result
     * @return JSON response containing the extraction result
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TableExtractionResult> extract(@RequestParam("file") MultipartFile file,
                                                         @RequestParam(value = "mode", required = false) String modeParam,
                                                         @RequestParam(value = "features", required = false) List<String> featureParams,
                                                         HttpSession session) {
        EnumSet<ExtractionFeature> features = ExtractionFeature.fromStrings(featureParams);
        TableExtractionResult result = pdfTableService.extractTables(file, RowBuildMode.fromString(modeParam, null), features);
        session.setAttribute(SESSION_RESULT_KEY, result);
        return ResponseEntity.ok(result);
    }

    /**
     * Returns the reconstructed table in its serialized line form.
     *
     * @param file      uploaded PDF
     * @param modeParam {@code basic} or {@code column-exact} (optional)
     * @return one serialized row per line
     */
    @PostMapping(value = "/api/extract/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> extractText(@RequestParam("file") MultipartFile file,
                                              @RequestParam(value = "mode", required = false) String modeParam) {
        String table = pdfTableService.extractSerializedTable(file, RowBuildMode.fromString(modeParam, null));
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(table);
    }

    /**
     * Streams the selected cached rows as a download.
     *
     * @param rowIds  selected row numbers
     * @param session HTTP session storing the cached extraction result
     * @return serialized rows as an attachment
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportRows(@RequestParam(name = "rowIds", required = false) List<Integer> rowIds,
                                             HttpSession session) {
        TableExtractionResult cached = (TableExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        String lines = rowExportService.exportSelectedRows(cached, rowIds);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"table-rows.txt\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(lines.getBytes(StandardCharsets.UTF_8));
    }
}
