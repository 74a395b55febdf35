/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsciiTableTest {

    private static AsciiTable newTable() {
        List<AsciiColumn> columns = List.of(
                new TextColumn(8, "NAME"),
                new IntColumn(5, "COUNT"),
                new FloatColumn(8, 2, "FLUX"));
        return AsciiTable.newSized(columns, 2);
    }

    @Test
    void testAddRowAppendsToEveryColumn() {
        AsciiTable table = newTable();
        table.addRow(List.of(new TableEntry.CharEntry("vega"), new TableEntry.IntEntry(3L), new TableEntry.FloatEntry(0.03)));
        table.addRow(List.of(new TableEntry.CharEntry("deneb"), new TableEntry.IntEntry(null), new TableEntry.FloatEntry(1.25)));

        assertThat(table.targetRowCount()).isEqualTo(2);
        assertThat(table.maxColumnLength()).isEqualTo(2);
        assertThat(table.textColumn(0).values()).containsExactly("vega", "deneb");
        assertThat(table.intColumn(1).values()).containsExactly(3L, null);
        assertThat(table.floatColumn(2).get(1)).isEqualTo(1.25);
        assertThat(table.column("COUNT").render(1)).isEmpty();
        assertThat(table.column("FLUX").render(0)).isEqualTo("0.03");
    }

    @Test
    void testRowShapeMustMatchColumns() {
        AsciiTable table = newTable();

        assertThatThrownBy(() -> table.addRow(List.of(new TableEntry.CharEntry("x"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1 fields but the table has 3 columns");
        assertThatThrownBy(() -> table.addRow(List.of(new TableEntry.IntEntry(1L), new TableEntry.IntEntry(1L),
                new TableEntry.FloatEntry(1.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NAME");
    }

    @Test
    void testTypedColumnAccess() {
        AsciiTable table = newTable();

        assertThat(table.columnFormats()).containsExactly(new TableEntryFormat.CharFormat(8),
                new TableEntryFormat.IntFormat(5), new TableEntryFormat.FloatFormat(8, 2));
        assertThatThrownBy(() -> table.textColumn(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> table.column("MISSING")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testConsumeInvalidatesTable() {
        AsciiTable table = newTable();

        List<AsciiColumn> columns = table.consume();
        assertThat(columns).hasSize(3);
        assertThat(table.isConsumed()).isTrue();
        assertThatThrownBy(table::columnCount).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(table::consume).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testPaddingAddsUndefinedCells() {
        IntColumn column = new IntColumn(3, null);
        column.add(5L);
        column.padTo(3);

        assertThat(column.length()).isEqualTo(3);
        assertThat(column.render(0)).isEqualTo("5");
        assertThat(column.render(2)).isEmpty();
    }

    @Test
    void testFloatRenderingKeepsDeclaredAndSignificantDigits() {
        FloatColumn column = new FloatColumn(10, 3, null);
        column.add(-3.14159);
        column.add(2.0);
        column.add(1.0E-7);
        column.add(-0.0);
        column.add(1500.0);

        assertThat(column.render(0)).isEqualTo("-3.14159");
        assertThat(column.render(1)).isEqualTo("2.000");
        assertThat(column.render(2)).isEqualTo("0.0000001");
        assertThat(column.render(3)).isEqualTo("-0.000");
        assertThat(column.render(4)).isEqualTo("1500.000");
    }

    @Test
    void testFloatRenderingRejectsNonFiniteValues() {
        FloatColumn column = new FloatColumn(10, 3, "FLUX");
        column.add(Double.NaN);

        assertThatThrownBy(() -> column.render(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FLUX");
    }
}
