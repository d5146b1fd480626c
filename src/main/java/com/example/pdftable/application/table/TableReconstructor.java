package com.example.pdftable.application.table;

import com.example.pdftable.config.TableExtractionProperties;
import com.example.pdftable.domain.model.PageLayout;
import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TableRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Rebuilds the table rows of a document page by page.
 * Pages share no state, so they may be processed in parallel; the rows are always returned in ascending page
 * order and numbered from 1 across the whole document.
 */
@Service
public class TableReconstructor {

    private static final Logger log = LoggerFactory.getLogger(TableReconstructor.class);

    private final TableExtractionProperties properties;

    public TableReconstructor(TableExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * @param pages page layouts of one document
     * @param mode  row building strategy
     * @return document rows in page order
     */
    public List<TableRow> reconstruct(List<PageLayout> pages, RowBuildMode mode) {
        if (pages == null || pages.isEmpty()) {
            return Collections.emptyList();
        }
        RowBuilder builder = builderFor(mode);
        Stream<PageLayout> stream = properties.isParallelPages() ? pages.parallelStream() : pages.stream();
        List<PageRows> perPage = new ArrayList<>(stream
                .map(page -> new PageRows(page.pageNumber(), builder.buildRows(page.fragments())))
                .toList());
        perPage.sort(Comparator.comparingInt(PageRows::pageNumber));

        List<TableRow> rows = new ArrayList<>();
        for (PageRows page : perPage) {
            log.debug("Page {}: {} row(s) in {} mode", page.pageNumber(), page.rows().size(), builder.mode());
            for (List<String> cells : page.rows()) {
                rows.add(new TableRow(rows.size() + 1, page.pageNumber(), cells));
            }
        }
        return rows;
    }

    /**
     * Resolves the row builder for a mode using the configured tolerances.
     *
     * @param mode requested mode, {@code null} selects the configured default
     * @return builder for the mode
     */
    public RowBuilder builderFor(RowBuildMode mode) {
        RowBuildMode effective = mode != null ? mode : properties.getMode();
        TableGeometry geometry = properties.toGeometry();
        return switch (effective) {
            case BASIC -> new BasicRowBuilder(geometry);
            case COLUMN_EXACT -> new ColumnExactRowBuilder(geometry);
        };
    }

    private record PageRows(int pageNumber, List<List<String>> rows) {
    }
}
