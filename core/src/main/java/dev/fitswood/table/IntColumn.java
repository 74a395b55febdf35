/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

/**
 * Column of {@code Iw} fields.
 */
public final class IntColumn extends Column<Long> {

    private final TableEntryFormat.IntFormat format;

    public IntColumn(TableEntryFormat.IntFormat format, String label, int expectedRows) {
        super(label, expectedRows);
        this.format = format;
    }

    public IntColumn(int width, String label) {
        this(new TableEntryFormat.IntFormat(width), label, 0);
    }

    @Override
    public TableEntryFormat.IntFormat format() {
        return format;
    }

    @Override
    public void accept(TableEntry entry) {
        if (!(entry instanceof TableEntry.IntEntry intEntry)) {
            throw new IllegalArgumentException("Integer column '" + label() + "' cannot hold " + entry);
        }
        add(intEntry.value());
    }

    @Override
    protected String renderValue(Long value) {
        return Long.toString(value);
    }
}
