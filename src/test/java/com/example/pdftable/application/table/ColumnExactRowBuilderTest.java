package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.ColumnInterval;
import com.example.pdftable.domain.model.RowBuildMode;
import com.example.pdftable.domain.model.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for column-aligned row assembly.
 */
class ColumnExactRowBuilderTest {

    private final ColumnExactRowBuilder builder = new ColumnExactRowBuilder(TableGeometry.defaults());

    @Test
    void fragmentsAreAlignedToPageColumns() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("Name", 10f, 40f, 700f),
                fragment("Amount", 200f, 240f, 700f),
                fragment("Widget", 10f, 45f, 680f),
                fragment("12.50", 205f, 230f, 680f)
        ));

        assertThat(rows).containsExactly(
                List.of("Name", "Amount"),
                List.of("Widget", "12.50")
        );
    }

    @Test
    void fragmentsSharingAColumnAreJoinedWithASpace() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("Description", 10f, 60f, 700f),
                fragment("Blue", 10f, 30f, 680f),
                fragment("widget", 33f, 60f, 680f),
                fragment("9.99", 200f, 230f, 680f)
        ));

        assertThat(rows).containsExactly(
                List.of("Description"),
                List.of("Blue widget", "9.99")
        );
    }

    @Test
    void emptyColumnsAreCompactedAway() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("Item", 10f, 40f, 700f),
                fragment("Qty", 120f, 140f, 700f),
                fragment("Price", 220f, 250f, 700f),
                fragment("3.00", 222f, 245f, 680f)
        ));

        assertThat(rows).containsExactly(
                List.of("Item", "Qty", "Price"),
                List.of("3.00")
        );
    }

    @Test
    void rowsChainOnThePreviousFragment() {
        List<List<String>> rows = builder.buildRows(List.of(
                fragment("a", 10f, 20f, 100f),
                fragment("b", 60f, 70f, 107f),
                fragment("c", 120f, 130f, 114f)
        ));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).containsExactly("a", "b", "c");
    }

    @Test
    void fragmentOutsideEveryColumnIsDropped() {
        List<ColumnInterval> columns = List.of(new ColumnInterval(0f, 20f), new ColumnInterval(100f, 120f));
        List<TextFragment> row = List.of(
                fragment("kept", 2f, 18f, 100f),
                fragment("stray", 50f, 60f, 100f),
                fragment("also kept", 101f, 119f, 100f)
        );

        assertThat(builder.assembleRow(row, columns)).containsExactly("kept", "also kept");
    }

    @Test
    void firstMatchingColumnWins() {
        List<ColumnInterval> columns = List.of(new ColumnInterval(0f, 40f), new ColumnInterval(30f, 80f));

        assertThat(builder.assembleRow(List.of(fragment("overlap", 32f, 38f, 100f)), columns))
                .containsExactly("overlap");
        assertThat(builder.assembleRow(List.of(
                fragment("left", 2f, 10f, 100f),
                fragment("overlap", 32f, 38f, 100f)), columns))
                .containsExactly("left overlap");
    }

    @Test
    void whitespaceIsCleanedBeforeJoining() {
        List<ColumnInterval> columns = List.of(new ColumnInterval(0f, 100f));
        List<TextFragment> row = List.of(
                fragment("Total:\n  42 ", 0f, 40f, 100f),
                fragment("  ", 45f, 50f, 100f),
                fragment("EUR", 55f, 70f, 100f)
        );

        assertThat(builder.assembleRow(row, columns)).containsExactly("Total: 42 EUR");
    }

    @Test
    void rowWithoutColumnsYieldsNoCells() {
        assertThat(builder.assembleRow(List.of(fragment("x", 0f, 5f, 100f)), List.of())).isEmpty();
        assertThat(builder.buildRows(List.of())).isEmpty();
    }

    @Test
    void reportsColumnExactMode() {
        assertThat(builder.mode()).isEqualTo(RowBuildMode.COLUMN_EXACT);
    }

    private static TextFragment fragment(String text, float x0, float x1, float y0) {
        return new TextFragment(text, x0, y0, x1, y0 + 10f, 800f);
    }
}
