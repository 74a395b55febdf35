/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.fitswood.FitsFormatException;
import dev.fitswood.metadata.FitsHeader;

/**
 * Row layout of an ASCII table extension as described by its header keywords.
 *
 * @param rowWidth characters per row ({@code NAXIS1})
 * @param rowCount number of rows ({@code NAXIS2})
 * @param formatCodes field format codes ({@code TFORMn}), in field order
 * @param labels field labels ({@code TTYPEn}); null if the table has none, single entries may be null
 * @param columnStarts zero based start of each field within a row ({@code TBCOLn - 1});
 *        null to place the fields one after the other
 */
public record AsciiTableLayout(int rowWidth, int rowCount, List<String> formatCodes, List<String> labels,
                               List<Integer> columnStarts) {

    public AsciiTableLayout {
        if (rowWidth < 0 || rowCount < 0) {
            throw new IllegalArgumentException("Invalid table dimensions " + rowWidth + " x " + rowCount);
        }
        formatCodes = List.copyOf(formatCodes);
        if (labels != null) {
            if (labels.size() != formatCodes.size()) {
                throw new IllegalArgumentException("Got " + labels.size() + " labels for " + formatCodes.size() + " fields");
            }
            labels = Collections.unmodifiableList(new ArrayList<>(labels));
        }
        if (columnStarts != null) {
            if (columnStarts.size() != formatCodes.size()) {
                throw new IllegalArgumentException("Got " + columnStarts.size() + " column starts for "
                        + formatCodes.size() + " fields");
            }
            columnStarts = List.copyOf(columnStarts);
        }
    }

    public AsciiTableLayout(int rowWidth, int rowCount, List<String> formatCodes) {
        this(rowWidth, rowCount, formatCodes, null, null);
    }

    public int fieldCount() {
        return formatCodes.size();
    }

    /** The label of the given field, or null. */
    public String label(int field) {
        return labels == null ? null : labels.get(field);
    }

    /**
     * Reads the layout from the {@code NAXIS1}, {@code NAXIS2}, {@code TFIELDS},
     * {@code TFORMn}, {@code TTYPEn} and {@code TBCOLn} keywords.
     */
    public static AsciiTableLayout fromHeader(FitsHeader header) throws FitsFormatException {
        int rowWidth = header.requireInt("NAXIS1");
        int rowCount = header.requireInt("NAXIS2");
        int fields = header.requireInt("TFIELDS");
        if (rowWidth < 0 || rowCount < 0 || fields < 0 || fields > 999) {
            throw new FitsFormatException("Invalid ASCII table dimensions: NAXIS1 = " + rowWidth + ", NAXIS2 = "
                    + rowCount + ", TFIELDS = " + fields);
        }

        List<String> formats = new ArrayList<>(fields);
        List<String> labels = new ArrayList<>(fields);
        List<Integer> starts = new ArrayList<>(fields);
        boolean anyLabel = false;
        boolean allStarts = true;
        for (int i = 1; i <= fields; i++) {
            formats.add(header.requireString("TFORM" + i));
            String label = header.getString("TTYPE" + i);
            anyLabel |= label != null;
            labels.add(label);
            long start = header.getLong("TBCOL" + i, -1);
            if (start > Integer.MAX_VALUE) {
                throw new FitsFormatException("TBCOL" + i + " out of range: " + start);
            }
            allStarts &= start >= 1;
            starts.add((int) start - 1);
        }
        return new AsciiTableLayout(rowWidth, rowCount, formats, anyLabel ? labels : null, allStarts ? starts : null);
    }

    /**
     * Writes the layout keywords into the given header.
     */
    public void applyTo(FitsHeader header) {
        header.set("NAXIS1", rowWidth, "width of table in characters");
        header.set("NAXIS2", rowCount, "number of rows in table");
        header.set("TFIELDS", fieldCount(), "number of fields in each row");
        for (int i = 0; i < fieldCount(); i++) {
            if (columnStarts != null) {
                header.set("TBCOL" + (i + 1), columnStarts.get(i) + 1);
            }
            header.set("TFORM" + (i + 1), formatCodes.get(i));
            String label = label(i);
            if (label != null) {
                header.set("TTYPE" + (i + 1), label);
            }
        }
    }
}
