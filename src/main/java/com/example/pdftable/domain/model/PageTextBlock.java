package com.example.pdftable.domain.model;

/**
 * Page-tagged text block handed to downstream chunking.
 * The page map lists one {@link BlockKind#TEXT} block per non-blank page, then one {@link BlockKind#TABLE} block per row.
 */
public record PageTextBlock(
        String text,
        int pageNumber,
        BlockKind kind
) {
}
