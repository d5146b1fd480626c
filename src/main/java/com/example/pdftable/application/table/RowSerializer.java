package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.TableRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical line form of reconstructed rows: {@code "\t " + cells joined by " \t " + " \t"}.
 * Downstream consumers split on the tab character, so the layout must not change.
 */
public final class RowSerializer {

    private static final String ROW_PREFIX = "\t ";
    private static final String CELL_SEPARATOR = " \t ";
    private static final String ROW_SUFFIX = " \t";
    private static final String ROW_SEPARATOR = "\n";

    private RowSerializer() {
    }

    public static String serializeRow(List<String> cells) {
        return ROW_PREFIX + String.join(CELL_SEPARATOR, cells) + ROW_SUFFIX;
    }

    public static List<String> serializeRows(List<TableRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            lines.add(serializeRow(row.cells()));
        }
        return lines;
    }

    /**
     * @param rows rows in page order
     * @return newline-joined serialized rows, empty string when there are none
     */
    public static String serializeTable(List<TableRow> rows) {
        return String.join(ROW_SEPARATOR, serializeRows(rows));
    }

    /**
     * Recovers the cells of a serialized row.
     * Tokens are split on the tab character, the empty leading and trailing tokens are dropped and the single
     * padding space around each cell is removed.
     *
     * @param line one serialized row
     * @return cells in their original order
     * @throws IllegalArgumentException when the line does not have the canonical layout
     */
    public static List<String> parseRow(String line) {
        if (line == null || !line.startsWith(ROW_PREFIX) || !line.endsWith(ROW_SUFFIX)) {
            throw new IllegalArgumentException("Not a serialized table row: " + line);
        }
        String[] tokens = line.split("\t", -1);
        List<String> cells = new ArrayList<>(Math.max(tokens.length - 2, 0));
        for (int i = 1; i < tokens.length - 1; i++) {
            String token = tokens[i];
            int start = token.startsWith(" ") ? 1 : 0;
            int end = token.length() > start && token.endsWith(" ") ? token.length() - 1 : token.length();
            cells.add(token.substring(start, end));
        }
        return cells;
    }
}
