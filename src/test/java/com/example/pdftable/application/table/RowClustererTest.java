package com.example.pdftable.application.table;

import com.example.pdftable.domain.model.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for vertical clustering of fragments into rows.
 */
class RowClustererTest {

    private final RowClusterer pinned = new RowClusterer(5f, RowClusterer.ReferencePolicy.PINNED_TO_FIRST);
    private final RowClusterer chained = new RowClusterer(5f, RowClusterer.ReferencePolicy.PREVIOUS_FRAGMENT);

    @Test
    void fragmentsOnTheSameBaselineShareARow() {
        List<List<TextFragment>> rows = pinned.cluster(List.of(
                fragment("right", 60f, 100f),
                fragment("left", 10f, 100f)
        ));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("right", "left");
    }

    @Test
    void fragmentsTenUnitsApartAreSplitTopFirst() {
        List<List<TextFragment>> rows = pinned.cluster(List.of(
                fragment("lower", 10f, 100f),
                fragment("upper", 10f, 110f)
        ));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("upper");
        assertThat(rows.get(1)).extracting(TextFragment::text).containsExactly("lower");
    }

    @Test
    void emptyInputYieldsNoRows() {
        assertThat(pinned.cluster(List.of())).isEmpty();
        assertThat(chained.cluster(null)).isEmpty();
    }

    @Test
    void blankFragmentsAreDiscardedBeforeClustering() {
        List<List<TextFragment>> rows = pinned.cluster(List.of(
                fragment("  \n ", 10f, 200f),
                fragment("kept", 10f, 100f)
        ));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("kept");
    }

    @Test
    void nonBreakingSpacesCountAsBlank() {
        List<List<TextFragment>> rows = pinned.cluster(List.of(
                fragment("\u00A0", 10f, 104f),
                fragment("\u2007\u202F", 40f, 103f),
                fragment("a", 10f, 100.5f),
                fragment("b", 60f, 97f)
        ));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("a", "b");
    }

    /**
     * Consecutive fragments 4 units apart keep chaining into one row even though the ends are 12 apart.
     */
    @Test
    void previousFragmentReferenceDriftsAcrossTheThreshold() {
        List<TextFragment> staircase = List.of(
                fragment("a", 10f, 0f),
                fragment("b", 30f, 4f),
                fragment("c", 50f, 8f),
                fragment("d", 70f, 12f)
        );

        List<List<TextFragment>> rows = chained.cluster(staircase);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("d", "c", "b", "a");
    }

    @Test
    void pinnedReferenceSplitsTheSameStaircase() {
        List<TextFragment> staircase = List.of(
                fragment("a", 10f, 0f),
                fragment("b", 30f, 4f),
                fragment("c", 50f, 8f),
                fragment("d", 70f, 12f)
        );

        List<List<TextFragment>> rows = pinned.cluster(staircase);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).extracting(TextFragment::text).containsExactly("d", "c");
        assertThat(rows.get(1)).extracting(TextFragment::text).containsExactly("b", "a");
    }

    @Test
    void pinnedRowsStayWithinThresholdOfTheirFirstMember() {
        Random random = new Random(42L);
        List<TextFragment> fragments = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            fragments.add(fragment("t" + i, random.nextFloat() * 500f, random.nextFloat() * 800f));
        }

        List<List<TextFragment>> rows = pinned.cluster(fragments);

        assertThat(rows).allSatisfy(row -> {
            float first = row.get(0).y0();
            assertThat(row).allSatisfy(member -> assertThat(Math.abs(member.y0() - first)).isLessThan(5f));
        });
        assertThat(rows.stream().mapToInt(List::size).sum()).isEqualTo(fragments.size());
    }

    private static TextFragment fragment(String text, float x0, float y0) {
        return new TextFragment(text, x0, y0, x0 + 20f, y0 + 10f, 800f);
    }
}
