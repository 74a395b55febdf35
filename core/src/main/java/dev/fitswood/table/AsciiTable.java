/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decoded content of a FITS ASCII table extension: an ordered set of columns
 * of possibly different types.
 * <p>
 * A table is filled row by row while decoding. Encoding consumes it through
 * {@link #consume()}, after which the table can no longer be used.
 * </p>
 */
public final class AsciiTable {

    private final int targetRowCount;
    private List<AsciiColumn> columns;

    private AsciiTable(List<AsciiColumn> columns, int targetRowCount) {
        this.columns = new ArrayList<>(columns);
        this.targetRowCount = targetRowCount;
    }

    /**
     * Creates a table from empty columns, expecting the given number of rows.
     */
    public static AsciiTable newSized(List<AsciiColumn> columns, int rowCount) {
        return new AsciiTable(columns, rowCount);
    }

    /**
     * Creates a table from already populated columns.
     */
    public static AsciiTable of(AsciiColumn... columns) {
        int rows = 0;
        for (AsciiColumn column : columns) {
            rows = Math.max(rows, column.length());
        }
        return new AsciiTable(List.of(columns), rows);
    }

    /** The number of rows the table was created for. */
    public int targetRowCount() {
        return targetRowCount;
    }

    public int columnCount() {
        return columns().size();
    }

    public AsciiColumn column(int index) {
        return columns().get(index);
    }

    /**
     * Returns the column with the given label.
     *
     * @throws IllegalArgumentException if there is no such column
     */
    public AsciiColumn column(String label) {
        for (AsciiColumn column : columns()) {
            if (label.equals(column.label())) {
                return column;
            }
        }
        throw new IllegalArgumentException("Column '" + label + "' not found");
    }

    public TextColumn textColumn(int index) {
        return typedColumn(index, TextColumn.class);
    }

    public IntColumn intColumn(int index) {
        return typedColumn(index, IntColumn.class);
    }

    public FloatColumn floatColumn(int index) {
        return typedColumn(index, FloatColumn.class);
    }

    private <C extends AsciiColumn> C typedColumn(int index, Class<C> type) {
        AsciiColumn column = column(index);
        if (!type.isInstance(column)) {
            throw new IllegalArgumentException("Column " + index + " is a " + column.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(column);
    }

    public List<AsciiColumn> columns() {
        checkNotConsumed();
        return Collections.unmodifiableList(columns);
    }

    /** Declared formats of all columns, in column order. */
    public List<TableEntryFormat> columnFormats() {
        List<TableEntryFormat> formats = new ArrayList<>(columnCount());
        for (AsciiColumn column : columns()) {
            formats.add(column.format());
        }
        return formats;
    }

    /** Length of the longest column. */
    public int maxColumnLength() {
        int max = 0;
        for (AsciiColumn column : columns()) {
            max = Math.max(max, column.length());
        }
        return max;
    }

    /**
     * Appends one decoded row, one entry per column.
     *
     * @throws IllegalArgumentException if the row does not match the columns
     */
    public void addRow(List<TableEntry> row) {
        List<AsciiColumn> cols = columns();
        if (row.size() != cols.size()) {
            throw new IllegalArgumentException("Row has " + row.size() + " fields but the table has "
                    + cols.size() + " columns");
        }
        for (int i = 0; i < row.size(); i++) {
            cols.get(i).accept(row.get(i));
        }
    }

    /**
     * Hands the columns over to the caller and invalidates this table.
     */
    public List<AsciiColumn> consume() {
        checkNotConsumed();
        List<AsciiColumn> result = columns;
        columns = null;
        return result;
    }

    public boolean isConsumed() {
        return columns == null;
    }

    private void checkNotConsumed() {
        if (columns == null) {
            throw new IllegalStateException("Table has been consumed");
        }
    }

    @Override
    public String toString() {
        if (columns == null) {
            return "AsciiTable[consumed]";
        }
        return "AsciiTable[columns=" + columns.size() + ", rows=" + maxColumnLength() + "]";
    }
}
