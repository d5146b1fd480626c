package com.example.pdftable.application.table;

import java.util.regex.Pattern;

/**
 * Normalizes fragment text into cell text.
 */
public final class CellText {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CellText() {
    }

    /**
     * Collapses every whitespace run (line breaks and tabs included) into a single space and trims the result.
     *
     * @param raw fragment text, may be {@code null}
     * @return cleaned text, empty when nothing visible remains
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(raw).replaceAll(" ").strip();
    }
}
