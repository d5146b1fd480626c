package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.ColumnInterval;
import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TextFragment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps every fragment onto the page-wide columns inferred by {@link ColumnBoundaryResolver}.
 * <p>
 * A fragment goes to the first column (left to right) that contains its span within the snap tolerance.
 * Fragments landing in the same column are joined with a single space; fragments matching no column are
 * dropped. Empty columns are removed from each row afterwards, so rows line up by content order rather than
 * by absolute column index.
 */
public final class ColumnExactRowBuilder implements RowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ColumnExactRowBuilder.class);

    private final RowClusterer clusterer;
    private final ColumnBoundaryResolver resolver;
    private final float snapTolerance;

    public ColumnExactRowBuilder(TableGeometry geometry) {
        this.clusterer = new RowClusterer(geometry.columnRowThreshold(), RowClusterer.ReferencePolicy.PREVIOUS_FRAGMENT);
        this.resolver = new ColumnBoundaryResolver(geometry.columnSnapTolerance(), geometry.mergeGapTolerance());
        this.snapTolerance = geometry.columnSnapTolerance();
    }

    @Override
    public List<List<String>> buildRows(List<TextFragment> fragments) {
        List<List<TextFragment>> rows = new ArrayList<>();
        for (List<TextFragment> row : clusterer.cluster(fragments)) {
            rows.add(FragmentOrder.leftToRight(row));
        }
        List<ColumnInterval> columns = resolver.resolve(rows);
        log.debug("Resolved {} column(s) across {} row(s)", columns.size(), rows.size());

        List<List<String>> result = new ArrayList<>();
        for (List<TextFragment> row : rows) {
            List<String> cells = assembleRow(row, columns);
            if (!cells.isEmpty()) {
                result.add(cells);
            }
        }
        return result;
    }

    /**
     * Fills one slot per column and compacts the filled ones.
     *
     * @param row     fragments of one row sorted by ascending {@code x0}
     * @param columns merged column intervals of the page
     * @return non-empty cells in column order
     */
    List<String> assembleRow(List<TextFragment> row, List<ColumnInterval> columns) {
        StringBuilder[] slots = new StringBuilder[columns.size()];
        for (TextFragment fragment : row) {
            String text = CellText.clean(fragment.text());
            if (text.isEmpty()) {
                continue;
            }
            int column = locateColumn(fragment, columns);
            if (column < 0) {
                log.debug("Dropping fragment '{}' at x0={} x1={}: no matching column", text, fragment.x0(), fragment.x1());
                continue;
            }
            if (slots[column] == null) {
                slots[column] = new StringBuilder(text);
            } else {
                slots[column].append(' ').append(text);
            }
        }
        List<String> cells = new ArrayList<>();
        for (StringBuilder slot : slots) {
            if (slot != null) {
                cells.add(slot.toString());
            }
        }
        return cells;
    }

    @Override
    public RowBuildMode mode() {
        return RowBuildMode.COLUMN_EXACT;
    }

    private int locateColumn(TextFragment fragment, List<ColumnInterval> columns) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).contains(fragment.x0(), fragment.x1(), snapTolerance)) {
                return i;
            }
        }
        return -1;
    }
}
