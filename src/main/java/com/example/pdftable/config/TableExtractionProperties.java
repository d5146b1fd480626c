package com.example.pdftable.config;

import com.example.pdftable.application.table.TableGeometry;
import com.example.pdftable.domain.model.RowBuildMode;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Externalized settings of the table reconstruction, bound from {@code table-extraction.*}.
 * Defaults reproduce the historical tolerances. Bound values are checked once the bean is initialized, so an
 * invalid tolerance stops the application at startup.
 */
@Component
@ConfigurationProperties(prefix = "table-extraction")
public class TableExtractionProperties implements InitializingBean {

    /**
     * What the service does when PDFBox cannot lay out a page.
     */
    public enum LayoutFailurePolicy {
        /** Propagate the failure and abort the document. */
        ABORT,
        /** Log the failure and continue with the next page. */
        SKIP_PAGE
    }

    /** Row building strategy used when a request does not name one. */
    private RowBuildMode mode = RowBuildMode.BASIC;

    /** Max y0 distance to the first fragment of a row in basic mode. */
    private float basicRowThreshold = TableGeometry.DEFAULT_BASIC_ROW_THRESHOLD;

    /** Max y0 distance to the previous fragment in column-exact mode. */
    private float columnRowThreshold = TableGeometry.DEFAULT_COLUMN_ROW_THRESHOLD;

    /** Slack when comparing fragment edges with column intervals. */
    private float columnSnapTolerance = TableGeometry.DEFAULT_COLUMN_SNAP_TOLERANCE;

    /** Max gap between two column intervals that are still merged. */
    private float mergeGapTolerance = TableGeometry.DEFAULT_MERGE_GAP_TOLERANCE;

    /** Max horizontal gap between PDFBox words on one baseline that still form a single fragment. */
    private float fragmentJoinGap = 5f;

    /** Reconstruct pages on the common fork-join pool. */
    private boolean parallelPages = false;

    private LayoutFailurePolicy layoutFailurePolicy = LayoutFailurePolicy.ABORT;

    /**
     * Rejects tolerances that cannot describe a distance.
     *
     * @throws IllegalArgumentException when a tolerance is negative or NaN
     */
    @Override
    public void afterPropertiesSet() {
        toGeometry();
        if (Float.isNaN(fragmentJoinGap) || fragmentJoinGap < 0f) {
            throw new IllegalArgumentException("fragmentJoinGap must be a non-negative number but was " + fragmentJoinGap);
        }
    }

    /**
     * @return immutable tolerance snapshot handed to the row builders
     */
    public TableGeometry toGeometry() {
        return new TableGeometry(basicRowThreshold, columnRowThreshold, columnSnapTolerance, mergeGapTolerance);
    }

    public RowBuildMode getMode() { return mode; }
    public void setMode(RowBuildMode mode) { this.mode = mode; }
    public float getBasicRowThreshold() { return basicRowThreshold; }
    public void setBasicRowThreshold(float basicRowThreshold) { this.basicRowThreshold = basicRowThreshold; }
    public float getColumnRowThreshold() { return columnRowThreshold; }
    public void setColumnRowThreshold(float columnRowThreshold) { this.columnRowThreshold = columnRowThreshold; }
    public float getColumnSnapTolerance() { return columnSnapTolerance; }
    public void setColumnSnapTolerance(float columnSnapTolerance) { this.columnSnapTolerance = columnSnapTolerance; }
    public float getMergeGapTolerance() { return mergeGapTolerance; }
    public void setMergeGapTolerance(float mergeGapTolerance) { this.mergeGapTolerance = mergeGapTolerance; }
    public float getFragmentJoinGap() { return fragmentJoinGap; }
    public void setFragmentJoinGap(float fragmentJoinGap) { this.fragmentJoinGap = fragmentJoinGap; }
    public boolean isParallelPages() { return parallelPages; }
    public void setParallelPages(boolean parallelPages) { this.parallelPages = parallelPages; }
    public LayoutFailurePolicy getLayoutFailurePolicy() { return layoutFailurePolicy; }
    public void setLayoutFailurePolicy(LayoutFailurePolicy layoutFailurePolicy) { this.layoutFailurePolicy = layoutFailurePolicy; }
}
