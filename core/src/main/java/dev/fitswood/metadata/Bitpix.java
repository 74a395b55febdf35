/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.metadata;

import dev.fitswood.FitsFormatException;

/**
 * Element types of FITS array payloads, as declared by the {@code BITPIX} keyword.
 * Positive codes denote two's complement integers, negative codes IEEE 754 floats.
 */
public enum Bitpix {
    BYTE(8, 1, "u8"),
    SHORT(16, 2, "i16"),
    INT(32, 4, "i32"),
    LONG(64, 8, "i64"),
    FLOAT(-32, 4, "f32"),
    DOUBLE(-64, 8, "f64");

    private final int code;
    private final int byteWidth;
    private final String elementTypeName;

    Bitpix(int code, int byteWidth, String elementTypeName) {
        this.code = code;
        this.byteWidth = byteWidth;
        this.elementTypeName = elementTypeName;
    }

    /** The value of the {@code BITPIX} keyword. */
    public int code() {
        return code;
    }

    /** Number of bytes one element occupies on disk. */
    public int byteWidth() {
        return byteWidth;
    }

    public String elementTypeName() {
        return elementTypeName;
    }

    public boolean isFloatingPoint() {
        return code < 0;
    }

    public static Bitpix fromCode(int code) throws FitsFormatException {
        for (Bitpix bitpix : values()) {
            if (bitpix.code == code) {
                return bitpix;
            }
        }
        throw new FitsFormatException("Unknown BITPIX: " + code + " (must be one of 8, 16, 32, 64, -32, -64)");
    }

    @Override
    public String toString() {
        return name() + "(" + code + ", " + elementTypeName + ")";
    }
}
