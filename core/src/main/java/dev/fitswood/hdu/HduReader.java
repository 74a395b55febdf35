/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.hdu;

import java.io.IOException;
import java.util.Arrays;

import dev.fitswood.FitsFormatException;
import dev.fitswood.image.TypedImage;
import dev.fitswood.internal.header.HeaderCodec;
import dev.fitswood.internal.image.ImageCodec;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.internal.table.AsciiTableCodec;
import dev.fitswood.metadata.Bitpix;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.reader.FitsContext;
import dev.fitswood.table.AsciiTableLayout;

/**
 * Reads one HDU: its header, then the payload, decoded according to the
 * {@code SIMPLE}/{@code XTENSION}, {@code BITPIX} and {@code NAXISn} keywords.
 */
public final class HduReader {

    private static final System.Logger LOG = System.getLogger(HduReader.class.getName());

    private HduReader() {
        // Utility class
    }

    public static Hdu read(BlockReader reader, FitsContext context) throws IOException {
        long offset = reader.position();
        FitsHeader header = HeaderCodec.read(reader);
        if (header.size() == 0) {
            throw new FitsFormatException("Empty header at offset " + offset);
        }

        String first = header.cards().get(0).keyword();
        Bitpix bitpix = Bitpix.fromCode(header.requireInt("BITPIX"));
        long[] axes = readAxes(header);

        Extension data;
        if (first.equals("SIMPLE")) {
            if (!header.getBoolean("SIMPLE", false)) {
                LOG.log(System.Logger.Level.WARNING, "{0} declares SIMPLE = F, decoding anyway", reader.source());
            }
            if (axes.length > 0 && axes[0] == 0 && header.getBoolean("GROUPS", false)) {
                data = readRandomGroups(reader, header, bitpix, axes);
            }
            else {
                data = readImage(reader, bitpix, axes);
            }
        }
        else if (first.equals("XTENSION")) {
            String type = header.requireString("XTENSION");
            data = switch (type) {
                case "IMAGE" -> readImage(reader, bitpix, axes);
                case "TABLE" -> {
                    if (bitpix != Bitpix.BYTE) {
                        throw new FitsFormatException("ASCII table extension must have BITPIX = 8 but has " + bitpix.code());
                    }
                    yield AsciiTableCodec.decode(reader, AsciiTableLayout.fromHeader(header), context);
                }
                case "BINTABLE", "A3DTABLE" -> readBinTable(reader, header, bitpix, axes);
                default -> throw new FitsFormatException("Unsupported extension type '" + type + "' at offset " + offset);
            };
        }
        else {
            throw new FitsFormatException("HDU at offset " + offset + " starts with " + first
                    + " instead of SIMPLE or XTENSION");
        }

        LOG.log(System.Logger.Level.DEBUG, "Read HDU at offset {0}: {1} header cards, data {2}",
                offset, header.size(), data);
        return new Hdu(header, data);
    }

    private static long[] readAxes(FitsHeader header) throws FitsFormatException {
        int naxis = header.requireInt("NAXIS");
        if (naxis < 0 || naxis > 999) {
            throw new FitsFormatException("Invalid NAXIS: " + naxis);
        }
        long[] axes = new long[naxis];
        for (int i = 0; i < naxis; i++) {
            axes[i] = header.requireLong("NAXIS" + (i + 1));
            if (axes[i] < 0) {
                throw new FitsFormatException("Negative NAXIS" + (i + 1) + ": " + axes[i]);
            }
        }
        return axes;
    }

    private static Extension readImage(BlockReader reader, Bitpix bitpix, long[] axes) throws IOException {
        if (axes.length == 0 || Arrays.stream(axes).anyMatch(axis -> axis == 0)) {
            return null;
        }
        TypedImage image = ImageCodec.decode(reader, bitpix, axes);
        return new Extension.ImageData(image);
    }

    private static Extension readBinTable(BlockReader reader, FitsHeader header, Bitpix bitpix, long[] axes)
            throws IOException {
        if (bitpix != Bitpix.BYTE || axes.length != 2) {
            throw new FitsFormatException("Binary table extension must have BITPIX = 8 and NAXIS = 2");
        }
        long heapSize = requireNonNegative(header, "PCOUNT", 0);
        long length;
        try {
            length = Math.addExact(Math.multiplyExact(axes[0], axes[1]), heapSize);
        }
        catch (ArithmeticException e) {
            throw new FitsFormatException("Binary table of " + axes[1] + " rows of " + axes[0]
                    + " bytes with a heap of " + heapSize + " bytes is too large", e);
        }
        byte[] data = readRaw(reader, length);
        return new Extension.BinTableData(axes[0], axes[1], heapSize, data);
    }

    private static Extension readRandomGroups(BlockReader reader, FitsHeader header, Bitpix bitpix, long[] axes)
            throws IOException {
        long groupCount = requireNonNegative(header, "GCOUNT", 1);
        long parameterCount = requireNonNegative(header, "PCOUNT", 0);
        long[] groupShape = Arrays.copyOfRange(axes, 1, axes.length);
        long length;
        try {
            long groupElements = 1;
            for (long axis : groupShape) {
                groupElements = Math.multiplyExact(groupElements, axis);
            }
            length = Math.multiplyExact(bitpix.byteWidth(),
                    Math.multiplyExact(groupCount, Math.addExact(parameterCount, groupElements)));
        }
        catch (ArithmeticException e) {
            throw new FitsFormatException("Random groups with shape " + Arrays.toString(groupShape) + ", "
                    + groupCount + " groups and " + parameterCount + " parameters are too large", e);
        }
        byte[] data = readRaw(reader, length);
        return new Extension.RandomGroupsData(bitpix, groupCount, parameterCount, groupShape, data);
    }

    private static long requireNonNegative(FitsHeader header, String keyword, long defaultValue)
            throws FitsFormatException {
        long value = header.getLong(keyword, defaultValue);
        if (value < 0) {
            throw new FitsFormatException("Negative " + keyword + ": " + value);
        }
        return value;
    }

    private static byte[] readRaw(BlockReader reader, long length) throws IOException {
        if (length > Integer.MAX_VALUE - 8 - Blocks.BLOCK_SIZE) {
            throw new FitsFormatException("Payload of " + length + " bytes is too large to read");
        }
        byte[] padded = new byte[Blocks.paddedArrayLength(length)];
        reader.readBlocks(padded);
        return Arrays.copyOf(padded, (int) length);
    }
}
