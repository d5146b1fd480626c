package com.example.pdftable.domain.model;

import java.util.List;

/**
 * Layout of one page as delivered by the fragment source.
 *
 * @param pageNumber 1-based page number
 * @param pageHeight height of the page in user space units
 * @param fragments  text fragments in appearance order
 * @param shapes     observed rectangles and lines
 */
public record PageLayout(
        int pageNumber,
        float pageHeight,
        List<TextFragment> fragments,
        List<LayoutShape> shapes
) {

    public PageLayout {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        shapes = shapes == null ? List.of() : List.copyOf(shapes);
    }
}
