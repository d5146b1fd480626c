package com.example.pdftable.domain.model;

/**
 * Domain DTO describing a drawn rectangle or line segment.
 * Shapes are reported alongside the text fragments but never decide how rows or columns are grouped.
 */
public record LayoutShape(
        ShapeKind kind,
        float x0,
        float y0,
        float x1,
        float y1
) {
}
