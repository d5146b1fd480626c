package com.example.pdftable.domain.model;

/**
 * Horizontal span {@code [xmin, xmax]} representing one inferred column of a page.
 */
public record ColumnInterval(float xmin, float xmax) {

    /**
     * Checks whether a left edge falls within this interval, widened by {@code tolerance} on both sides.
     *
     * @param x         left edge of a fragment
     * @param tolerance snap tolerance
     * @return {@code true} when the edge snaps to this interval
     */
    public boolean acceptsLeftEdge(float x, float tolerance) {
        return x >= xmin - tolerance && x <= xmax + tolerance;
    }

    /**
     * Checks whether the span {@code [x0, x1]} fits inside this interval, widened by {@code tolerance}.
     *
     * @param x0        left edge
     * @param x1        right edge
     * @param tolerance snap tolerance
     * @return {@code true} when the span is contained
     */
    public boolean contains(float x0, float x1, float tolerance) {
        return x0 >= xmin - tolerance && x1 <= xmax + tolerance;
    }

    /**
     * @param x0 left edge to include
     * @param x1 right edge to include
     * @return a new interval covering this one and the given span
     */
    public ColumnInterval extend(float x0, float x1) {
        return new ColumnInterval(Math.min(xmin, x0), Math.max(xmax, x1));
    }
}
