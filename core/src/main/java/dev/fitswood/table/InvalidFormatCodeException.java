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
 * Thrown when a table cannot be set up because one of its field format codes
 * is not understood. No rows have been read at that point.
 */
public class InvalidFormatCodeException extends FitsFormatException {

    private static final long serialVersionUID = 1L;

    private final String code;

    public InvalidFormatCodeException(String code) {
        super("Invalid ASCII table field format code: '" + code + "'");
        this.code = code;
    }

    public InvalidFormatCodeException(String code, String message) {
        super(message);
        this.code = code;
    }

    /** The format code as found in the header. */
    public String code() {
        return code;
    }
}
