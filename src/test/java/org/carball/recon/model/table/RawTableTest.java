package org.carball.recon.model.table;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RawTableTest {

    @Test
    public void shouldReadMissingTrailingCellsAsEmpty() {
        RawTable table = new RawTable(List.of("a", "b", "c"), List.of(List.of("1")));

        assertThat(table.cell(0, 0)).isEqualTo("1");
        assertThat(table.cell(0, 2)).isEmpty();
        assertThat(table.columnCount()).isEqualTo(3);
    }

    @Test
    public void shouldTreatNullCellsAsEmpty() {
        RawTable table = new RawTable(Arrays.asList("a", null), List.of(Arrays.asList(null, "x")));

        assertThat(table.headers()).containsExactly("a", "");
        assertThat(table.cell(0, 0)).isEmpty();
    }

    @Test
    public void shouldCountOnlyRowsWithContent() {
        RawTable table = new RawTable(List.of("a", "b"), List.of(
                List.of("1", ""),
                List.of(" ", "\t"),
                List.of(),
                List.of("", "2")));

        assertThat(table.rowCount()).isEqualTo(4);
        assertThat(table.isBlankRow(1)).isTrue();
        assertThat(table.isBlankRow(2)).isTrue();
        assertThat(table.nonBlankRowCount()).isEqualTo(2);
    }

    @Test
    public void shouldTreatUnicodeSpacesAsBlank() {
        RawTable table = new RawTable(List.of("a", "b"), List.of(
                List.of("\u00a0", "\u3000 "),
                List.of("\u00a0x", "")));

        assertThat(table.isBlankRow(0)).isTrue();
        assertThat(table.isBlankRow(1)).isFalse();
        assertThat(RawTable.isBlankCell("\u2007\t")).isTrue();
        assertThat(RawTable.stripCell("\u00a0 2001-02-28\u3000")).isEqualTo("2001-02-28");
        assertThat(RawTable.stripCell("a\u00a0b")).isEqualTo("a\u00a0b");
    }

    @Test
    public void shouldIgnoreCellsBeyondHeaderWidth() {
        RawTable table = new RawTable(List.of("a", "b"), List.of(
                List.of("", "", "stray"),
                List.of("", "1", "stray")));

        assertThat(table.isBlankRow(0)).isTrue();
        assertThat(table.isBlankRow(1)).isFalse();
        assertThat(table.nonBlankRowCount()).isEqualTo(1);
    }

    @Test
    public void shouldNotShareStateWithCaller() {
        List<String> headers = new ArrayList<>(List.of("a"));
        RawTable table = new RawTable(headers, List.of());

        headers.add("b");

        assertThat(table.headers()).containsExactly("a");
        assertThatThrownBy(() -> table.headers().add("c")).isInstanceOf(UnsupportedOperationException.class);
    }
}
