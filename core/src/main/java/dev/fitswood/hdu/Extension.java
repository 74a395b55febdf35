/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.hdu;

import java.util.Arrays;

import dev.fitswood.image.TypedImage;
import dev.fitswood.metadata.Bitpix;
import dev.fitswood.table.AsciiTable;

/**
 * The decoded payload of one HDU. The variant is chosen from the header
 * keywords, never from the data.
 * <p>
 * Binary tables and random groups are carried as raw big-endian bytes (without
 * block padding); their fields are not decoded.
 * </p>
 */
public sealed interface Extension
        permits Extension.AsciiTableData, Extension.BinTableData, Extension.ImageData, Extension.RandomGroupsData {

    record AsciiTableData(AsciiTable table) implements Extension {
    }

    /**
     * @param rowWidth bytes per row ({@code NAXIS1})
     * @param rowCount number of rows ({@code NAXIS2})
     * @param heapSize bytes following the main table ({@code PCOUNT})
     * @param data main table followed by the heap
     */
    record BinTableData(long rowWidth, long rowCount, long heapSize, byte[] data) implements Extension {

        @Override
        public String toString() {
            return "BinTableData[rowWidth=" + rowWidth + ", rowCount=" + rowCount + ", heapSize=" + heapSize + "]";
        }
    }

    record ImageData(TypedImage image) implements Extension {
    }

    /**
     * @param bitpix element type of parameters and group arrays
     * @param groupCount number of groups ({@code GCOUNT})
     * @param parameterCount parameters preceding each group array ({@code PCOUNT})
     * @param groupShape axes of each group array ({@code NAXIS2} onwards)
     * @param data all groups, back to back
     */
    record RandomGroupsData(Bitpix bitpix, long groupCount, long parameterCount, long[] groupShape, byte[] data)
            implements Extension {

        @Override
        public String toString() {
            return "RandomGroupsData[bitpix=" + bitpix + ", groupCount=" + groupCount + ", parameterCount="
                    + parameterCount + ", groupShape=" + Arrays.toString(groupShape) + "]";
        }
    }
}
