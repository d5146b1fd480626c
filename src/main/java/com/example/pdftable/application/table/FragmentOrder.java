package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.TextFragment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orderings shared by the clustering and assembly steps. Both sorts are stable.
 */
final class FragmentOrder {

    static final Comparator<TextFragment> TOP_DOWN =
            Comparator.comparingDouble(TextFragment::y0).reversed();

    static final Comparator<TextFragment> LEFT_TO_RIGHT =
            Comparator.comparingDouble(TextFragment::x0);

    private FragmentOrder() {
    }

    static List<TextFragment> leftToRight(List<TextFragment> row) {
        List<TextFragment> sorted = new ArrayList<>(row);
        sorted.sort(LEFT_TO_RIGHT);
        return sorted;
    }
}
