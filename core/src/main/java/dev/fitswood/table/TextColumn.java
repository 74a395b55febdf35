/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

/**
 * Column of {@code Aw} fields.
 */
public final class TextColumn extends Column<String> {

    private final TableEntryFormat.CharFormat format;

    public TextColumn(TableEntryFormat.CharFormat format, String label, int expectedRows) {
        super(label, expectedRows);
        this.format = format;
    }

    public TextColumn(int width, String label) {
        this(new TableEntryFormat.CharFormat(width), label, 0);
    }

    @Override
    public TableEntryFormat.CharFormat format() {
        return format;
    }

    @Override
    public void accept(TableEntry entry) {
        if (!(entry instanceof TableEntry.CharEntry charEntry)) {
            throw new IllegalArgumentException("Text column '" + label() + "' cannot hold " + entry);
        }
        add(charEntry.value());
    }

    @Override
    protected String renderValue(String value) {
        return value;
    }
}
