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
 * One decoded ASCII table cell, typed after the {@link TableEntryFormat} of its field.
 * Numeric entries hold {@code null} when the field is entirely blank.
 */
public sealed interface TableEntry permits TableEntry.CharEntry, TableEntry.IntEntry, TableEntry.FloatEntry {

    Object value();

    /**
     * Converts the raw text of a field into an entry of the kind declared by its format.
     *
     * @throws NumberFormatException if the text of a numeric field is not a number
     * @throws IllegalArgumentException if the format is invalid
     */
    static TableEntry fromParts(String text, TableEntryFormat format) {
        if (format instanceof TableEntryFormat.CharFormat) {
            return new CharEntry(text.stripTrailing());
        }

        String trimmed = text.strip();
        if (format instanceof TableEntryFormat.IntFormat) {
            return new IntEntry(trimmed.isEmpty() ? null : Long.parseLong(trimmed));
        }
        if (format instanceof TableEntryFormat.FloatFormat floatFormat) {
            return new FloatEntry(trimmed.isEmpty() ? null : parseFixedPoint(trimmed, floatFormat.precision()));
        }
        throw new IllegalArgumentException("Cannot decode a field with format " + format);
    }

    /**
     * Parses a Fortran fixed-point number. A {@code D} exponent is accepted; when
     * the text has neither a decimal point nor an exponent, the last
     * {@code precision} digits are the fraction.
     */
    private static double parseFixedPoint(String text, int precision) {
        String normalized = text.replace('D', 'E').replace('d', 'E');
        BigDecimal value = new BigDecimal(normalized);
        boolean explicitPoint = normalized.indexOf('.') >= 0 || normalized.indexOf('E') >= 0
                || normalized.indexOf('e') >= 0;
        if (!explicitPoint) {
            value = value.movePointLeft(precision);
        }
        double result = value.doubleValue();
        // BigDecimal drops the sign of zero
        return result == 0 && normalized.startsWith("-") ? -0.0 : result;
    }

    record CharEntry(String value) implements TableEntry {
    }

    record IntEntry(Long value) implements TableEntry {
    }

    record FloatEntry(Double value) implements TableEntry {
    }
}
