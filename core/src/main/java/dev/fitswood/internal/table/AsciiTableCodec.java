/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.table;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import dev.fitswood.FitsFormatException;
import dev.fitswood.hdu.Extension;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.reader.FitsContext;
import dev.fitswood.table.AsciiColumn;
import dev.fitswood.table.AsciiTable;
import dev.fitswood.table.AsciiTableLayout;
import dev.fitswood.table.FieldParseException;
import dev.fitswood.table.InvalidFormatCodeException;
import dev.fitswood.table.TableEntry;
import dev.fitswood.table.TableEntryFormat;

/**
 * Decodes and encodes the payload of FITS ASCII table extensions.
 * <p>
 * Decoding reads the whole table with one block-aligned read, then converts
 * the rows in parallel on the executor of the {@link FitsContext}. Each task
 * handles a contiguous range of rows and returns one result per row; the
 * results are appended to the table afterwards, on the calling thread and in
 * file order. If several rows fail, the error of the first one is reported.
 * </p>
 */
public final class AsciiTableCodec {

    private static final System.Logger LOG = System.getLogger(AsciiTableCodec.class.getName());

    private static final byte BLANK = (byte) ' ';

    private AsciiTableCodec() {
        // Utility class
    }

    /**
     * Encoded table rows together with the layout they were written with.
     *
     * @param layout the layout of {@code data}, for the table keywords of the header
     * @param data all rows back to back, without block padding
     */
    public record EncodedTable(AsciiTableLayout layout, byte[] data) {
    }

    /** Outcome of decoding one row: either its entries or the error. */
    private record DecodedRow(List<TableEntry> entries, FitsFormatException error) {
    }

    public static Extension.AsciiTableData decode(BlockReader reader, AsciiTableLayout layout, FitsContext context)
            throws IOException {
        int rowWidth = layout.rowWidth();
        int rowCount = layout.rowCount();
        long byteSize = (long) rowWidth * rowCount;

        TableDecodeEvent event = new TableDecodeEvent();
        event.begin();

        List<TableEntryFormat> formats = parseFormats(layout.formatCodes());
        int[] widths = new int[formats.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = formats.get(i).fieldWidth();
        }
        int[] starts = columnStarts(layout, formats, widths);
        AsciiTable table = setupTable(formats, layout, rowCount);

        // Tables are small compared to images, so the whole payload is read at once
        byte[] wholeTable = allocate(layout, byteSize);
        reader.readBlocks(wholeTable);

        LOG.log(System.Logger.Level.DEBUG, "Decoding ASCII table with {0} rows of {1} characters, {2} fields",
                rowCount, rowWidth, formats.size());

        // Block padding past the last declared row is never looked at
        int rowsPerTask = context.rowsPerTask();
        int taskCount = (int) ((rowCount + (long) rowsPerTask - 1) / rowsPerTask);

        @SuppressWarnings("unchecked")
        CompletableFuture<DecodedRow[]>[] futures = new CompletableFuture[taskCount];
        for (int task = 0; task < taskCount; task++) {
            final int firstRow = task * rowsPerTask;
            final int endRow = (int) Math.min(rowCount, (long) firstRow + rowsPerTask);
            futures[task] = CompletableFuture.supplyAsync(
                    () -> decodeRows(wholeTable, firstRow, endRow, rowWidth, starts, widths, formats),
                    context.executor());
        }

        try {
            CompletableFuture.allOf(futures).join();
        }
        catch (CompletionException e) {
            throw unwrap(e);
        }

        // Append sequentially, in row order
        for (CompletableFuture<DecodedRow[]> future : futures) {
            for (DecodedRow row : future.join()) {
                if (row.error() != null) {
                    throw row.error();
                }
                table.addRow(row.entries());
            }
        }

        event.rows = rowCount;
        event.fields = formats.size();
        event.size = wholeTable.length;
        event.tasks = taskCount;
        event.commit();

        return new Extension.AsciiTableData(table);
    }

    private static byte[] allocate(AsciiTableLayout layout, long byteSize) throws FitsFormatException {
        try {
            return new byte[Blocks.paddedArrayLength(byteSize)];
        }
        catch (IllegalArgumentException e) {
            throw new FitsFormatException("ASCII table of " + layout.rowCount() + " rows of " + layout.rowWidth()
                    + " characters is too large to decode", e);
        }
    }

    private static List<TableEntryFormat> parseFormats(List<String> codes) throws InvalidFormatCodeException {
        List<TableEntryFormat> formats = new ArrayList<>(codes.size());
        for (String code : codes) {
            TableEntryFormat format = TableEntryFormat.parse(code);
            if (format instanceof TableEntryFormat.InvalidFormat invalid) {
                throw new InvalidFormatCodeException(invalid.originalCode());
            }
            formats.add(format);
        }
        return formats;
    }

    private static int[] columnStarts(AsciiTableLayout layout, List<TableEntryFormat> formats, int[] widths)
            throws InvalidFormatCodeException {
        int[] starts = new int[widths.length];
        int offset = 0;
        for (int i = 0; i < widths.length; i++) {
            starts[i] = layout.columnStarts() != null ? layout.columnStarts().get(i) : offset;
            offset += widths[i];

            if (starts[i] < 0 || starts[i] + widths[i] > layout.rowWidth()) {
                String code = formats.get(i).code();
                throw new InvalidFormatCodeException(code, "Field " + i + " with format " + code + " at offset "
                        + starts[i] + " does not fit into a row of " + layout.rowWidth() + " characters");
            }
        }
        return starts;
    }

    private static AsciiTable setupTable(List<TableEntryFormat> formats, AsciiTableLayout layout, int rowCount) {
        List<AsciiColumn> columns = new ArrayList<>(formats.size());
        for (int i = 0; i < formats.size(); i++) {
            columns.add(AsciiColumn.forFormat(formats.get(i), layout.label(i), rowCount));
        }
        return AsciiTable.newSized(columns, rowCount);
    }

    private static DecodedRow[] decodeRows(byte[] wholeTable, int firstRow, int endRow, int rowWidth, int[] starts,
                                           int[] widths, List<TableEntryFormat> formats) {
        CharsetDecoder decoder = StandardCharsets.US_ASCII.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        DecodedRow[] rows = new DecodedRow[endRow - firstRow];
        for (int row = firstRow; row < endRow; row++) {
            rows[row - firstRow] = decodeRow(wholeTable, row, row * rowWidth, starts, widths, formats, decoder);
        }
        return rows;
    }

    private static DecodedRow decodeRow(byte[] wholeTable, int row, int rowOffset, int[] starts, int[] widths,
                                        List<TableEntryFormat> formats, CharsetDecoder decoder) {
        List<TableEntry> entries = new ArrayList<>(widths.length);
        for (int field = 0; field < widths.length; field++) {
            String text;
            try {
                text = decoder.decode(ByteBuffer.wrap(wholeTable, rowOffset + starts[field], widths[field])).toString();
            }
            catch (CharacterCodingException e) {
                return new DecodedRow(null, new FitsFormatException("Field " + field + " of row " + row
                        + " is not ASCII text", e));
            }

            try {
                entries.add(TableEntry.fromParts(text, formats.get(field)));
            }
            catch (NumberFormatException e) {
                return new DecodedRow(null, new FieldParseException(row, field, text, formats.get(field), e));
            }
        }
        return new DecodedRow(entries, null);
    }

    /**
     * Encodes the table and writes it, padded with blanks to the block boundary.
     * The table is consumed.
     *
     * @return the layout of the written rows
     */
    public static AsciiTableLayout encode(AsciiTable table, BlockWriter writer) throws IOException {
        EncodedTable encoded = render(table);
        writer.writePadded(encoded.data(), BLANK);
        return encoded.layout();
    }

    /**
     * Renders all rows of the table into one byte array. The table is consumed.
     * <p>
     * Columns shorter than the longest one are padded with empty cells first.
     * Every column is then rendered at one fixed width: the larger of its
     * declared width and its longest cell. Numeric cells are right-justified,
     * text cells left-justified.
     * </p>
     */
    public static EncodedTable render(AsciiTable table) {
        int rowCount = table.maxColumnLength();
        List<AsciiColumn> columns = table.consume();
        for (AsciiColumn column : columns) {
            column.padTo(rowCount);
        }

        int columnCount = columns.size();
        int[] widths = new int[columnCount];
        for (int c = 0; c < columnCount; c++) {
            AsciiColumn column = columns.get(c);
            int width = column.format().fieldWidth();
            for (int row = 0; row < rowCount; row++) {
                width = Math.max(width, column.render(row).length());
            }
            widths[c] = width;
        }

        int[] starts = new int[columnCount];
        int rowWidth = 0;
        for (int c = 0; c < columnCount; c++) {
            starts[c] = rowWidth;
            rowWidth += widths[c];
        }

        byte[] data = new byte[Math.multiplyExact(rowWidth, rowCount)];
        Arrays.fill(data, BLANK);
        for (int row = 0; row < rowCount; row++) {
            int rowOffset = row * rowWidth;
            for (int c = 0; c < columnCount; c++) {
                AsciiColumn column = columns.get(c);
                String text = column.render(row);
                boolean rightJustified = !(column.format() instanceof TableEntryFormat.CharFormat);
                int offset = rowOffset + starts[c] + (rightJustified ? widths[c] - text.length() : 0);
                writeAscii(text, data, offset, column, row);
            }
        }

        List<String> codes = new ArrayList<>(columnCount);
        List<String> labels = new ArrayList<>(columnCount);
        List<Integer> startList = new ArrayList<>(columnCount);
        boolean anyLabel = false;
        for (int c = 0; c < columnCount; c++) {
            AsciiColumn column = columns.get(c);
            codes.add(column.format().withWidth(widths[c]).code());
            labels.add(column.label());
            anyLabel |= column.label() != null;
            startList.add(starts[c]);
        }

        LOG.log(System.Logger.Level.DEBUG, "Encoded ASCII table with {0} rows of {1} characters, {2} fields",
                rowCount, rowWidth, columnCount);

        AsciiTableLayout layout = new AsciiTableLayout(rowWidth, rowCount, codes, anyLabel ? labels : null, startList);
        return new EncodedTable(layout, data);
    }

    private static void writeAscii(String text, byte[] target, int offset, AsciiColumn column, int row) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                throw new IllegalArgumentException("Cell " + row + " of column '" + column.label()
                        + "' contains a character that cannot be written to an ASCII table: " + text);
            }
            target[offset + i] = (byte) c;
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
}
