package com.example.pdftable.domain.model;

/**
 * Origin of a {@link PageTextBlock}: running page text or a serialized table row.
 */
public enum BlockKind {
    TEXT,
    TABLE
}
