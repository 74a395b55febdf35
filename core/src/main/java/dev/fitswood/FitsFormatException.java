/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood;

import java.io.IOException;

/**
 * Signals that the content of a FITS file does not conform to the format,
 * e.g. an unknown BITPIX code, a missing mandatory keyword or table field text
 * that cannot be decoded. The decode of the affected HDU is aborted.
 */
public class FitsFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public FitsFormatException(String message) {
        super(message);
    }

    public FitsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
