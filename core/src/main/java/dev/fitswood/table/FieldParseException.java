/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import dev.fitswood.FitsFormatException;

/**
 * Thrown when the text of a table field cannot be converted to the type its
 * format declares. Row and field indices are zero based.
 */
public class FieldParseException extends FitsFormatException {

    private static final long serialVersionUID = 1L;

    private final int row;
    private final int field;
    private final String text;

    public FieldParseException(int row, int field, String text, TableEntryFormat format, Throwable cause) {
        super("Cannot parse field " + field + " of row " + row + " as " + format.code() + ": '" + text + "'", cause);
        this.row = row;
        this.field = field;
        this.text = text;
    }

    public int row() {
        return row;
    }

    public int field() {
        return field;
    }

    public String text() {
        return text;
    }
}
