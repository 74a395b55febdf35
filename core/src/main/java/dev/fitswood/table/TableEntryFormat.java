/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Format of one ASCII table field, as declared by a Fortran-style {@code TFORMn}
 * code such as {@code A10}, {@code I5} or {@code F8.3}.
 * <p>
 * Parsing is total: codes that do not match the grammar become an
 * {@link InvalidFormat} holding the original text, so the error can be reported
 * when a column is set up from it.
 * </p>
 */
public sealed interface TableEntryFormat
        permits TableEntryFormat.CharFormat, TableEntryFormat.IntFormat,
        TableEntryFormat.FloatFormat, TableEntryFormat.InvalidFormat {

    Pattern CHAR_CODE = Pattern.compile("A(\\d+)");
    Pattern INT_CODE = Pattern.compile("I(\\d+)");
    Pattern FLOAT_CODE = Pattern.compile("F(\\d+)(?:\\.(\\d+))?");

    /** Number of characters the field occupies in a row. */
    int fieldWidth();

    /** The canonical format code, e.g. {@code F8.3}. */
    String code();

    /**
     * Returns a format of the same kind with the given width.
     */
    TableEntryFormat withWidth(int width);

    static TableEntryFormat parse(String code) {
        String trimmed = code.strip();

        Matcher matcher = CHAR_CODE.matcher(trimmed);
        if (matcher.matches()) {
            int width = parseWidth(matcher.group(1));
            return width > 0 ? new CharFormat(width) : new InvalidFormat(code);
        }
        matcher = INT_CODE.matcher(trimmed);
        if (matcher.matches()) {
            int width = parseWidth(matcher.group(1));
            return width > 0 ? new IntFormat(width) : new InvalidFormat(code);
        }
        matcher = FLOAT_CODE.matcher(trimmed);
        if (matcher.matches()) {
            int width = parseWidth(matcher.group(1));
            int precision = matcher.group(2) != null ? parseWidth(matcher.group(2)) : 0;
            return width > 0 && precision >= 0 ? new FloatFormat(width, precision) : new InvalidFormat(code);
        }
        return new InvalidFormat(code);
    }

    /** Returns -1 for numbers that do not fit an int. */
    private static int parseWidth(String digits) {
        try {
            return Integer.parseInt(digits);
        }
        catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Text field, {@code Aw}. */
    record CharFormat(int width) implements TableEntryFormat {

        @Override
        public int fieldWidth() {
            return width;
        }

        @Override
        public String code() {
            return "A" + width;
        }

        @Override
        public CharFormat withWidth(int width) {
            return new CharFormat(width);
        }
    }

    /** Integer field, {@code Iw}. */
    record IntFormat(int width) implements TableEntryFormat {

        @Override
        public int fieldWidth() {
            return width;
        }

        @Override
        public String code() {
            return "I" + width;
        }

        @Override
        public IntFormat withWidth(int width) {
            return new IntFormat(width);
        }
    }

    /** Fixed-point field, {@code Fw.d}. */
    record FloatFormat(int width, int precision) implements TableEntryFormat {

        @Override
        public int fieldWidth() {
            return width;
        }

        @Override
        public String code() {
            return "F" + width + "." + precision;
        }

        @Override
        public FloatFormat withWidth(int width) {
            return new FloatFormat(width, precision);
        }
    }

    /** A code that could not be parsed; keeps the original text for error reporting. */
    record InvalidFormat(String originalCode) implements TableEntryFormat {

        @Override
        public int fieldWidth() {
            throw new IllegalStateException("Invalid field format code '" + originalCode + "' has no width");
        }

        @Override
        public String code() {
            return originalCode;
        }

        @Override
        public InvalidFormat withWidth(int width) {
            return this;
        }
    }
}
