package com.example.pdftable.application.service;

import com.example.pdftable.application.table.RowSerializer;
import com.example.pdftable.application.table.TableReconstructor;
import com.example.pdftable.config.TableExtractionProperties;
import com.example.pdftable.config.TableExtractionProperties.LayoutFailurePolicy;
import com.example.pdftable.domain.exception.PdfFileRequiredException;
import com.example.pdftable.domain.exception.PdfNotFoundException;
import com.example.pdftable.domain.exception.PdfPathRequiredException;
import com.example.pdftable.domain.exception.UnsupportedPdfFormatException;
import com.example.pdftable.domain.model.BlockKind;
import com.example.pdftable.domain.model.ExtractionFeature;
import com.example.pdftable.domain.model.PageLayout;
import com.example.pdftable.domain.model.PageTextBlock;
import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TableExtractionResult;
import com.example.pdftable.domain.model.TableRow;
import com.example.pdftable.domain.model.TextFragment;
import com.example.pdftable.infrastructure.exception.DocumentLayoutException;
import com.example.pdftable.infrastructure.exception.PdfProcessingException;
import com.example.pdftable.infrastructure.pdf.PdfBoxLayoutReader;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application-layer service that orchestrates table reconstruction for a PDF.
 * It validates inputs, reads page layouts through PDFBox, applies the layout failure policy and hands the pages to
 * the {@link TableReconstructor}.
 */
@Service
public class PdfTableService {

    private static final Logger log = LoggerFactory.getLogger(PdfTableService.class);

    private final PdfBoxLayoutReader layoutReader;
    private final TableReconstructor reconstructor;
    private final TableExtractionProperties properties;

    /**
     * @param layoutReader  adapter producing page layouts from PDFBox
     * @param reconstructor row and column inference
     * @param properties    extraction settings (default mode, failure policy)
     */
    public PdfTableService(PdfBoxLayoutReader layoutReader,
                           TableReconstructor reconstructor,
                           TableExtractionProperties properties) {
        this.layoutReader = layoutReader;
        this.reconstructor = reconstructor;
        this.properties = properties;
    }

    /**
     * Extracts every feature from the uploaded file using the configured default mode.
     *
     * @param file uploaded PDF file
     * @return extraction result containing rows, serialized rows and page blocks
     */
    public TableExtractionResult extractTables(MultipartFile file) {
        return extractTables(file, null, ExtractionFeature.allFeatures());
    }

    /**
     * Extracts the requested features from the uploaded PDF file.
     *
     * @param file     uploaded file
     * @param mode     row building mode, {@code null} for the configured default
     * @param features subset of {@link ExtractionFeature} to compute
     * @return extraction result containing only the requested payloads
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException        when PDFBox cannot read the bytes
     * @throws DocumentLayoutException       when a page fails and the policy is {@code ABORT}
     */
    public TableExtractionResult extractTables(MultipartFile file, RowBuildMode mode, Set<ExtractionFeature> features) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
        return extractInternal(bytes, resolveFileName(file), mode, normalizeFeatures(features));
    }

    /**
     * Reads a PDF from the filesystem and extracts every feature with the configured default mode.
     *
     * @param pdfPath path pointing to a PDF file on disk
     * @return extraction result
     */
    public TableExtractionResult extractTables(Path pdfPath) {
        return extractTables(pdfPath, null, ExtractionFeature.allFeatures());
    }

    /**
     * Reads a PDF from the filesystem and extracts the requested features.
     *
     * @param pdfPath  path pointing to a PDF file on disk
     * @param mode     row building mode, {@code null} for the configured default
     * @param features subset of {@link ExtractionFeature}
     * @return extraction result containing only the requested payloads
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be read
     */
    public TableExtractionResult extractTables(Path pdfPath, RowBuildMode mode, Set<ExtractionFeature> features) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(pdfPath);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the PDF at " + pdfPath, e);
        }
        String fileName = pdfPath.getFileName() != null ? pdfPath.getFileName().toString() : "document.pdf";
        return extractInternal(bytes, fileName, mode, normalizeFeatures(features));
    }

    /**
     * Reconstructs the table and returns it in serialized form, one line per row.
     *
     * @param file uploaded PDF
     * @param mode row building mode, {@code null} for the configured default
     * @return newline-joined serialized rows
     */
    public String extractSerializedTable(MultipartFile file, RowBuildMode mode) {
        TableExtractionResult result = extractTables(file, mode, EnumSet.of(ExtractionFeature.SERIALIZED_TABLE));
        return String.join("\n", result.serializedRows());
    }

    private EnumSet<ExtractionFeature> normalizeFeatures(Set<ExtractionFeature> features) {
        if (features == null || features.isEmpty()) {
            return ExtractionFeature.allFeatures();
        }
        return features instanceof EnumSet<ExtractionFeature> enumSet
                ? enumSet.clone()
                : EnumSet.copyOf(features);
    }

    /**
     * Shared implementation regardless of the request source.
     *
     * @param bytes    PDF bytes already loaded into memory
     * @param fileName logical name used for display purposes
     * @param mode     requested mode or {@code null}
     * @param features normalized set of requested features
     * @return populated extraction result
     */
    private TableExtractionResult extractInternal(byte[] bytes, String fileName, RowBuildMode mode,
                                                  EnumSet<ExtractionFeature> features) {
        RowBuildMode effectiveMode = mode != null ? mode : properties.getMode();
        try (PDDocument document = Loader.loadPDF(bytes)) {
            List<PageLayout> pages = readPages(document);
            List<TableRow> rows = reconstructor.reconstruct(pages, effectiveMode);
            List<String> serialized = RowSerializer.serializeRows(rows);

            log.info("Extracted {} row(s) from {} ({} page(s), {} mode)",
                    rows.size(), fileName, document.getNumberOfPages(), effectiveMode);

            return new TableExtractionResult(
                    fileName,
                    document.getNumberOfPages(),
                    effectiveMode,
                    features.contains(ExtractionFeature.TABLE_ROWS) ? rows : null,
                    features.contains(ExtractionFeature.SERIALIZED_TABLE) ? serialized : null,
                    features.contains(ExtractionFeature.PAGE_TEXT) ? buildPageBlocks(pages, rows, serialized) : null
            );
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the PDF " + fileName + ".", e);
        }
    }

    /**
     * Reads every page layout, applying the configured {@link LayoutFailurePolicy} to failing pages.
     *
     * @param document loaded PDF document
     * @return layouts of the readable pages in page order
     */
    private List<PageLayout> readPages(PDDocument document) {
        List<PageLayout> pages = new ArrayList<>(document.getNumberOfPages());
        for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
            try {
                pages.add(layoutReader.readPage(document, pageIndex));
            } catch (DocumentLayoutException ex) {
                if (properties.getLayoutFailurePolicy() != LayoutFailurePolicy.SKIP_PAGE) {
                    throw ex;
                }
                log.warn("Skipping page {}: {}", ex.getPageNumber(), ex.getMessage(), ex);
            }
        }
        return pages;
    }

    /**
     * Builds the page map: one text block per non-blank page, then one table block per row.
     *
     * @param pages      page layouts
     * @param rows       reconstructed rows
     * @param serialized serialized form of {@code rows}, same order
     * @return page-tagged blocks in page order
     */
    private List<PageTextBlock> buildPageBlocks(List<PageLayout> pages, List<TableRow> rows, List<String> serialized) {
        List<PageTextBlock> blocks = new ArrayList<>();
        for (PageLayout page : pages) {
            String pageText = page.fragments().stream()
                    .map(TextFragment::text)
                    .map(String::strip)
                    .filter(text -> !text.isEmpty())
                    .collect(Collectors.joining("\n"));
            if (!pageText.isEmpty()) {
                blocks.add(new PageTextBlock(pageText, page.pageNumber(), BlockKind.TEXT));
            }
        }
        for (int i = 0; i < rows.size(); i++) {
            blocks.add(new PageTextBlock(serialized.get(i).strip(), rows.get(i).pageNumber(), BlockKind.TABLE));
        }
        return blocks;
    }

    /**
     * Performs a lightweight PDF detection check based on MIME type and file name.
     *
     * @param file uploaded file
     * @return {@code true} when the content type or suffix indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
