package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.ColumnInterval;
import com.example.pdftable.domain.model.TextFragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Infers the page-wide, left-to-right column intervals from the horizontal spans of every fragment.
 * <p>
 * Discovery is first-fit: fragments are visited row by row, left to right inside a row, and each one widens the
 * first interval its left edge snaps to (or opens a new interval). The visiting order therefore changes the result
 * and must be kept. The merge phase then folds intervals separated by no more than the gap tolerance.
 */
public final class ColumnBoundaryResolver {

    private static final Comparator<ColumnInterval> BY_XMIN = Comparator.comparingDouble(ColumnInterval::xmin);

    private final float snapTolerance;
    private final float mergeGapTolerance;

    public ColumnBoundaryResolver(float snapTolerance, float mergeGapTolerance) {
        this.snapTolerance = snapTolerance;
        this.mergeGapTolerance = mergeGapTolerance;
    }

    /**
     * Runs discovery followed by merge.
     *
     * @param rows rows of one page, each sorted by ascending {@code x0}
     * @return merged intervals ordered by {@code xmin}; empty when the page has no fragments
     */
    public List<ColumnInterval> resolve(List<List<TextFragment>> rows) {
        return merge(discover(rows));
    }

    /**
     * First phase: first-fit interval discovery over the fragments in row order.
     *
     * @param rows rows of one page, each sorted by ascending {@code x0}
     * @return discovered intervals in creation order
     */
    List<ColumnInterval> discover(List<List<TextFragment>> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<ColumnInterval> intervals = new ArrayList<>();
        for (List<TextFragment> row : rows) {
            for (TextFragment fragment : row) {
                int index = firstSnapping(intervals, fragment.x0());
                if (index < 0) {
                    intervals.add(new ColumnInterval(fragment.x0(), fragment.x1()));
                } else {
                    intervals.set(index, intervals.get(index).extend(fragment.x0(), fragment.x1()));
                }
            }
        }
        return intervals;
    }

    /**
     * Second phase: sorts by {@code xmin} and merges neighbours whose gap is within the merge tolerance.
     * Applying it to its own output returns an equal list.
     *
     * @param intervals discovered intervals in any order
     * @return merged, sorted intervals
     */
    public List<ColumnInterval> merge(List<ColumnInterval> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            return Collections.emptyList();
        }
        List<ColumnInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(BY_XMIN);

        List<ColumnInterval> merged = new ArrayList<>();
        for (ColumnInterval interval : sorted) {
            if (merged.isEmpty()) {
                merged.add(interval);
                continue;
            }
            int last = merged.size() - 1;
            ColumnInterval previous = merged.get(last);
            if (interval.xmin() <= previous.xmax() + mergeGapTolerance) {
                merged.set(last, new ColumnInterval(previous.xmin(), Math.max(previous.xmax(), interval.xmax())));
            } else {
                merged.add(interval);
            }
        }
        return merged;
    }

    private int firstSnapping(List<ColumnInterval> intervals, float x0) {
        for (int i = 0; i < intervals.size(); i++) {
            if (intervals.get(i).acceptsLeftEdge(x0, snapTolerance)) {
                return i;
            }
        }
        return -1;
    }
}
