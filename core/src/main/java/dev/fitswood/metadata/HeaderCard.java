/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.metadata;

/**
 * One 80 character header record.
 * <p>
 * Value cards carry a {@link String}, {@link Boolean}, {@link Long} or
 * {@link Double} value. Commentary cards ({@code COMMENT}, {@code HISTORY},
 * blank keyword and any card without a value indicator) have a null value and
 * keep their text in {@code comment}.
 * </p>
 */
public record HeaderCard(String keyword, Object value, String comment) {

    public static final int LENGTH = 80;
    public static final int KEYWORD_LENGTH = 8;

    public HeaderCard {
        if (keyword.length() > KEYWORD_LENGTH) {
            throw new IllegalArgumentException("Keyword '" + keyword + "' is longer than " + KEYWORD_LENGTH + " characters");
        }
        for (int i = 0; i < keyword.length(); i++) {
            char c = keyword.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == ' ')) {
                throw new IllegalArgumentException("Illegal character '" + c + "' in keyword '" + keyword + "'");
            }
        }
        if (value != null && !(value instanceof String || value instanceof Boolean || value instanceof Long
                || value instanceof Double)) {
            throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName()
                    + " for keyword '" + keyword + "'");
        }
        keyword = keyword.stripTrailing();
    }

    public static HeaderCard of(String keyword, Object value) {
        return new HeaderCard(keyword, normalize(value), null);
    }

    public static HeaderCard of(String keyword, Object value, String comment) {
        return new HeaderCard(keyword, normalize(value), comment);
    }

    public static HeaderCard commentary(String keyword, String text) {
        return new HeaderCard(keyword, null, text);
    }

    public static HeaderCard end() {
        return new HeaderCard("END", null, null);
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isEnd() {
        return "END".equals(keyword) && value == null;
    }

    /** Widens int and float values to the stored types. */
    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
