package com.example.pdftable.domain.model;

import java.util.regex.Pattern;

/**
 * Domain DTO for a single run of text extracted from a page together with its axis-aligned bounding box.
 * Coordinates use the PDF user space: origin at the bottom-left corner, {@code y} growing upward.
 */
public record TextFragment(
        String text,
        float x0,
        float y0,
        float x1,
        float y1,
        float pageHeight
) {

    // \s under UNICODE_CHARACTER_CLASS also covers NBSP, U+2007 and U+202F
    private static final Pattern VISIBLE_CHARACTER = Pattern.compile("\\S", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * @return {@code true} when the fragment carries visible text after trimming
     */
    public boolean hasText() {
        return text != null && VISIBLE_CHARACTER.matcher(text).find();
    }
}
