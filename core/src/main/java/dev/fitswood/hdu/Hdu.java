/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.hdu;

import dev.fitswood.metadata.FitsHeader;

/**
 * One header data unit.
 *
 * @param header the header records
 * @param data the decoded payload, or null if the HDU has none ({@code NAXIS = 0})
 */
public record Hdu(FitsHeader header, Extension data) {

    public boolean hasData() {
        return data != null;
    }

    /** Whether this is a primary HDU, i.e. its header starts with {@code SIMPLE}. */
    public boolean isPrimary() {
        return header.size() > 0 && header.cards().get(0).keyword().equals("SIMPLE");
    }
}
