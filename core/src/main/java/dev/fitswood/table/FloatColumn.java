/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.math.BigDecimal;

/**
 * Column of {@code Fw.d} fields. Values render with at least {@code d} fraction
 * digits and with as many more as are needed to reproduce the value exactly,
 * which an explicit decimal point in the field allows.
 */
public final class FloatColumn extends Column<Double> {

    private final TableEntryFormat.FloatFormat format;

    public FloatColumn(TableEntryFormat.FloatFormat format, String label, int expectedRows) {
        super(label, expectedRows);
        this.format = format;
    }

    public FloatColumn(int width, int precision, String label) {
        this(new TableEntryFormat.FloatFormat(width, precision), label, 0);
    }

    @Override
    public TableEntryFormat.FloatFormat format() {
        return format;
    }

    @Override
    public void accept(TableEntry entry) {
        if (!(entry instanceof TableEntry.FloatEntry floatEntry)) {
            throw new IllegalArgumentException("Fixed-point column '" + label() + "' cannot hold " + entry);
        }
        add(floatEntry.value());
    }

    @Override
    protected String renderValue(Double value) {
        if (value.isNaN() || value.isInfinite()) {
            throw new IllegalArgumentException("Fixed-point column '" + label() + "' cannot render " + value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < format.precision()) {
            decimal = decimal.setScale(format.precision());
        }
        String text = decimal.toPlainString();
        // BigDecimal has no negative zero
        return value == 0 && Double.doubleToRawLongBits(value) != 0 ? "-" + text : text;
    }
}
