package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.TextFragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups the fragments of one page into visual rows by chaining on vertical proximity.
 * <p>
 * Fragments are walked top to bottom (descending {@code y0}). A fragment joins the open row when its
 * {@code y0} is closer than {@code rowThreshold} to the row's reference; otherwise the row is closed and a
 * new one starts with that fragment. Which fragment acts as the reference is decided by the
 * {@link ReferencePolicy}.
 */
public final class RowClusterer {

    /**
     * Which {@code y0} a candidate fragment is compared against.
     */
    public enum ReferencePolicy {
        /**
         * The first fragment of the row. No member can be further than the threshold from it.
         */
        PINNED_TO_FIRST,
        /**
         * The fragment added just before. Long rows may drift past the threshold cumulatively.
         */
        PREVIOUS_FRAGMENT
    }

    private final float rowThreshold;
    private final ReferencePolicy policy;

    public RowClusterer(float rowThreshold, ReferencePolicy policy) {
        this.rowThreshold = rowThreshold;
        this.policy = policy;
    }

    /**
     * Clusters a page's fragments into rows.
     *
     * @param fragments fragments of one page in appearance order
     * @return rows ordered top to bottom; every row holds at least one fragment
     */
    public List<List<TextFragment>> cluster(List<TextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return Collections.emptyList();
        }
        List<TextFragment> sorted = new ArrayList<>(fragments.size());
        for (TextFragment fragment : fragments) {
            if (fragment != null && fragment.hasText()) {
                sorted.add(fragment);
            }
        }
        sorted.sort(FragmentOrder.TOP_DOWN);

        RowAccumulator accumulator = new RowAccumulator();
        for (TextFragment fragment : sorted) {
            accumulator.accept(fragment);
        }
        return accumulator.finish();
    }

    /**
     * Page-scoped fold state: the finished rows, the open row and its reference {@code y0}.
     */
    private final class RowAccumulator {
        private final List<List<TextFragment>> rows = new ArrayList<>();
        private List<TextFragment> current;
        private float referenceY;

        void accept(TextFragment fragment) {
            if (current == null) {
                open(fragment);
                return;
            }
            if (Math.abs(fragment.y0() - referenceY) < rowThreshold) {
                current.add(fragment);
                if (policy == ReferencePolicy.PREVIOUS_FRAGMENT) {
                    referenceY = fragment.y0();
                }
                return;
            }
            rows.add(current);
            open(fragment);
        }

        private void open(TextFragment fragment) {
            current = new ArrayList<>();
            current.add(fragment);
            referenceY = fragment.y0();
        }

        List<List<TextFragment>> finish() {
            if (current != null) {
                rows.add(current);
                current = null;
            }
            return rows;
        }
    }
}
