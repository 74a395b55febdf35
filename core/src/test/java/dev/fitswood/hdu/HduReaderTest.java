/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.hdu;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.fitswood.FitsFormatException;
import dev.fitswood.internal.header.HeaderCodec;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.metadata.HeaderCard;
import dev.fitswood.reader.FitsContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HduReaderTest {

    private FitsContext context;

    @BeforeEach
    void createContext() {
        context = FitsContext.create(1);
    }

    @AfterEach
    void closeContext() {
        context.close();
    }

    private static FitsHeader binTableHeader(long rowWidth, long rowCount, long heapSize) {
        return new FitsHeader()
                .add(HeaderCard.of("XTENSION", "BINTABLE"))
                .add(HeaderCard.of("BITPIX", 8))
                .add(HeaderCard.of("NAXIS", 2))
                .add(HeaderCard.of("NAXIS1", rowWidth))
                .add(HeaderCard.of("NAXIS2", rowCount))
                .add(HeaderCard.of("PCOUNT", heapSize))
                .add(HeaderCard.of("GCOUNT", 1));
    }

    private static FitsHeader randomGroupsHeader(long parameterCount, long groupCount) {
        return new FitsHeader()
                .add(HeaderCard.of("SIMPLE", true))
                .add(HeaderCard.of("BITPIX", 16))
                .add(HeaderCard.of("NAXIS", 2))
                .add(HeaderCard.of("NAXIS1", 0))
                .add(HeaderCard.of("NAXIS2", 3))
                .add(HeaderCard.of("GROUPS", true))
                .add(HeaderCard.of("PCOUNT", parameterCount))
                .add(HeaderCard.of("GCOUNT", groupCount));
    }

    /** The header followed by one block of payload. */
    private static BlockReader readerFor(FitsHeader header) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (BlockWriter writer = BlockWriter.of(out)) {
            HeaderCodec.write(header, writer);
            writer.writeBlocks(new byte[Blocks.BLOCK_SIZE]);
        }
        return BlockReader.of(new ByteArrayInputStream(out.toByteArray()));
    }

    @Test
    void testReadsBinaryTableWithHeap() throws Exception {
        Hdu hdu = HduReader.read(readerFor(binTableHeader(4, 2, 6)), context);

        Extension.BinTableData data = (Extension.BinTableData) hdu.data();
        assertThat(data.rowWidth()).isEqualTo(4);
        assertThat(data.rowCount()).isEqualTo(2);
        assertThat(data.heapSize()).isEqualTo(6);
        assertThat(data.data()).hasSize(14);
    }

    @Test
    void testNegativeHeapSizeIsFormatError() {
        assertThatThrownBy(() -> HduReader.read(readerFor(binTableHeader(4, 1, -100)), context))
                .isInstanceOf(FitsFormatException.class)
                .hasMessage("Negative PCOUNT: -100");
    }

    @Test
    void testOverflowingBinaryTableSizeIsFormatError() {
        long axis = 1L << 32;

        assertThatThrownBy(() -> HduReader.read(readerFor(binTableHeader(axis, axis, 0)), context))
                .isInstanceOf(FitsFormatException.class)
                .hasMessageContaining("too large")
                .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void testReadsRandomGroups() throws Exception {
        Hdu hdu = HduReader.read(readerFor(randomGroupsHeader(1, 2)), context);

        Extension.RandomGroupsData data = (Extension.RandomGroupsData) hdu.data();
        assertThat(data.groupShape()).containsExactly(3);
        assertThat(data.groupCount()).isEqualTo(2);
        // 2 groups of 1 parameter and 3 elements, 2 bytes each
        assertThat(data.data()).hasSize(16);
    }

    @Test
    void testNegativeGroupCountIsFormatError() {
        assertThatThrownBy(() -> HduReader.read(readerFor(randomGroupsHeader(1, -2)), context))
                .isInstanceOf(FitsFormatException.class)
                .hasMessage("Negative GCOUNT: -2");
    }

    @Test
    void testOverflowingGroupSizeIsFormatError() {
        assertThatThrownBy(() -> HduReader.read(readerFor(randomGroupsHeader(1, Long.MAX_VALUE / 2)), context))
                .isInstanceOf(FitsFormatException.class)
                .hasMessageContaining("too large");
    }
}
