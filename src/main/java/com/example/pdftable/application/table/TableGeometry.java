package com.example.pdftable.application.table;

/**
 * Tolerances used by the row and column inference, in PDF user space units.
 *
 * @param basicRowThreshold   max {@code y0} distance to the first fragment of a row in basic mode
 * @param columnRowThreshold  max {@code y0} distance to the previous fragment in column-exact mode
 * @param columnSnapTolerance slack applied when a fragment edge is compared with a column interval
 * @param mergeGapTolerance   max horizontal gap for two column intervals to be merged
 */
public record TableGeometry(
        float basicRowThreshold,
        float columnRowThreshold,
        float columnSnapTolerance,
        float mergeGapTolerance
) {

    public static final float DEFAULT_BASIC_ROW_THRESHOLD = 5f;
    public static final float DEFAULT_COLUMN_ROW_THRESHOLD = 8f;
    public static final float DEFAULT_COLUMN_SNAP_TOLERANCE = 5f;
    public static final float DEFAULT_MERGE_GAP_TOLERANCE = 10f;

    public TableGeometry {
        requireNonNegative(basicRowThreshold, "basicRowThreshold");
        requireNonNegative(columnRowThreshold, "columnRowThreshold");
        requireNonNegative(columnSnapTolerance, "columnSnapTolerance");
        requireNonNegative(mergeGapTolerance, "mergeGapTolerance");
    }

    /**
     * @return geometry with the historical tolerances (5 / 8 / 5 / 10)
     */
    public static TableGeometry defaults() {
        return new TableGeometry(
                DEFAULT_BASIC_ROW_THRESHOLD,
                DEFAULT_COLUMN_ROW_THRESHOLD,
                DEFAULT_COLUMN_SNAP_TOLERANCE,
                DEFAULT_MERGE_GAP_TOLERANCE
        );
    }

    private static void requireNonNegative(float value, String name) {
        if (Float.isNaN(value) || value < 0f) {
            throw new IllegalArgumentException(name + " must be a non-negative number but was " + value);
        }
    }
}
