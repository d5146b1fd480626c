package com.example.pdftable.domain.model;

/**
 * Kind of vector geometry observed on a page.
 */
public enum ShapeKind {
    RECTANGLE,
    LINE
}
