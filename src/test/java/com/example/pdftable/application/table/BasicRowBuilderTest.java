package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BasicRowBuilderTest {

    private final BasicRowBuilder builder = new BasicRowBuilder(TableGeometry.defaults());

    @Test
    void cellsAreOrderedLeftToRight() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("second", 60f, 100f),
                fragment("first", 10f, 100f)
        ));

        assertThat(rows).containsExactly(List.of("first", "second"));
    }

    @Test
    void rowsMayHaveDifferentCellCounts() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("Name", 10f, 700f),
                fragment("Qty", 120f, 700f),
                fragment("Price", 220f, 700f),
                fragment("Subtotal", 10f, 680f),
                fragment("42.00", 220f, 680f)
        ));

        assertThat(rows).containsExactly(
                List.of("Name", "Qty", "Price"),
                List.of("Subtotal", "42.00")
        );
    }

    @Test
    void whitespaceInsideAFragmentIsCollapsed() {
        List<List<String>> rows = builder.buildRows(List.of(fragment("Total:\n  42 ", 10f, 100f)));

        assertThat(rows).containsExactly(List.of("Total: 42"));
    }

    @Test
    void pageWithoutTextProducesNoRows() {
        assertThat(builder.buildRows(List.of())).isEmpty();
        assertThat(builder.buildRows(List.of(fragment(" \t ", 10f, 100f)))).isEmpty();
    }

    /**
     * A fragment made only of no-break spaces must not become the pinned reference of a row.
     */
    @Test
    void noBreakSpaceFragmentDoesNotAnchorARow() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("\u00A0", 10f, 104f),
                fragment("a", 10f, 100.5f),
                fragment("b", 60f, 97f)
        ));

        assertThat(rows).containsExactly(List.of("a", "b"));
    }

    @Test
    void reportsBasicMode() {
        assertThat(builder.mode()).isEqualTo(RowBuildMode.BASIC);
    }

    private static TextFragment fragment(String text, float x0, float y0) {
        return new TextFragment(text, x0, y0, x0 + 30f, y0 + 10f, 800f);
    }
}
