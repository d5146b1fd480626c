package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TextFragment;

import java.util.List;

/**
 * Turns the fragments of a single page into ordered rows of cell texts.
 * Implementations hold no state between calls, so one instance can serve several pages concurrently.
 */
public interface RowBuilder {

    /**
     * @param fragments fragments of one page in appearance order
     * @return rows top to bottom, each a non-empty list of cleaned cells ordered left to right
     */
    List<List<String>> buildRows(List<TextFragment> fragments);

    /**
     * @return the mode this builder implements
     */
    RowBuildMode mode();
}
