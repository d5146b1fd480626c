package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TextFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits one cell per fragment. Rows are clustered against their first fragment and cell counts may differ
 * between rows.
 */
public final class BasicRowBuilder implements RowBuilder {

    private final RowClusterer clusterer;

    public BasicRowBuilder(TableGeometry geometry) {
        this.clusterer = new RowClusterer(geometry.basicRowThreshold(), RowClusterer.ReferencePolicy.PINNED_TO_FIRST);
    }

    @Override
    public List<List<String>> buildRows(List<TextFragment> fragments) {
        List<List<String>> rows = new ArrayList<>();
        for (List<TextFragment> row : clusterer.cluster(fragments)) {
            List<String> cells = new ArrayList<>(row.size());
            for (TextFragment fragment : FragmentOrder.leftToRight(row)) {
                String text = CellText.clean(fragment.text());
                if (!text.isEmpty()) {
                    cells.add(text);
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }

    @Override
    public RowBuildMode mode() {
        return RowBuildMode.BASIC;
    }
}
