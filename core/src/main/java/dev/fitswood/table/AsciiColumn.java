/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

/**
 * Capability shared by all ASCII table columns regardless of their element type.
 * Lets a table hold text, integer and fixed-point columns side by side.
 */
public interface AsciiColumn {

    /** The {@code TTYPEn} label, or null if the column has none. */
    String label();

    /** The declared field format. */
    TableEntryFormat format();

    /** Number of cells in this column. */
    int length();

    /**
     * Renders the cell at the given row as text, without padding. Undefined
     * cells render as the empty string.
     */
    String render(int row);

    /**
     * Appends a decoded entry.
     *
     * @throws IllegalArgumentException if the entry does not match the column type
     */
    void accept(TableEntry entry);

    /**
     * Appends undefined cells until the column has the given length.
     */
    void padTo(int length);

    /**
     * Creates an empty column for the given format.
     *
     * @throws IllegalArgumentException for an {@link TableEntryFormat.InvalidFormat}
     */
    static AsciiColumn forFormat(TableEntryFormat format, String label, int expectedRows) {
        if (format instanceof TableEntryFormat.CharFormat charFormat) {
            return new TextColumn(charFormat, label, expectedRows);
        }
        if (format instanceof TableEntryFormat.IntFormat intFormat) {
            return new IntColumn(intFormat, label, expectedRows);
        }
        if (format instanceof TableEntryFormat.FloatFormat floatFormat) {
            return new FloatColumn(floatFormat, label, expectedRows);
        }
        throw new IllegalArgumentException("No column type for format " + format);
    }
}
