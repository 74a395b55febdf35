/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.fitswood.hdu.Extension;
import dev.fitswood.hdu.Hdu;
import dev.fitswood.image.TypedImage;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.metadata.Bitpix;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.metadata.HeaderCard;
import dev.fitswood.reader.FitsContext;
import dev.fitswood.reader.FitsFileReader;
import dev.fitswood.reader.FitsFileWriter;
import dev.fitswood.table.AsciiTable;
import dev.fitswood.table.FloatColumn;
import dev.fitswood.table.IntColumn;
import dev.fitswood.table.TextColumn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitsFileRoundTripTest {

    private static FitsContext context;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void createContext() {
        context = FitsContext.create(2, 3);
    }

    @AfterAll
    static void closeContext() {
        context.close();
    }

    private static AsciiTable catalog() {
        TextColumn names = new TextColumn(8, "NAME");
        IntColumn counts = new IntColumn(4, "COUNT");
        FloatColumn fluxes = new FloatColumn(9, 2, "FLUX");
        String[] objects = { "M31", "M33", "NGC 253", "NGC 4594", "IC 342" };
        for (int i = 0; i < objects.length; i++) {
            names.add(objects[i]);
            counts.add(i == 2 ? null : (long) (i * 10));
            fluxes.add(1.25 * (i + 1));
        }
        return AsciiTable.of(names, counts, fluxes);
    }

    @Test
    void testWritesAndReadsMixedFile() throws Exception {
        Path file = tempDir.resolve("mixed.fits");
        FitsHeader primaryHeader = new FitsHeader()
                .add(HeaderCard.of("OBJECT", "M31", "target"))
                .add(HeaderCard.commentary("HISTORY", "synthetic"));
        int[] pixels = new int[12];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i * i - 20;
        }
        byte[] binTable = { 1, 2, 3, 4, 5, 6 };

        FitsFileWriter.writeAll(file, List.of(
                new Hdu(primaryHeader, new Extension.ImageData(TypedImage.of(pixels.clone(), 4, 3))),
                new Hdu(new FitsHeader().add(HeaderCard.of("EXTNAME", "CATALOG")), new Extension.AsciiTableData(catalog())),
                new Hdu(new FitsHeader(), new Extension.BinTableData(3, 2, 0, binTable))));

        assertThat(Files.size(file) % Blocks.BLOCK_SIZE).isZero();

        List<Hdu> hdus = FitsFileReader.readAll(file, context);
        assertThat(hdus).hasSize(3);

        Hdu primary = hdus.get(0);
        assertThat(primary.isPrimary()).isTrue();
        assertThat(primary.header().getString("OBJECT")).isEqualTo("M31");
        assertThat(primary.header().getCard("OBJECT").comment()).isEqualTo("target");
        assertThat(primary.header().getLong("NAXIS1", -1)).isEqualTo(4);
        TypedImage image = ((Extension.ImageData) primary.data()).image();
        assertThat(image.shape()).containsExactly(4, 3);
        assertThat(image.takeInts()).containsExactly(pixels);

        Hdu table = hdus.get(1);
        assertThat(table.header().getString("XTENSION")).isEqualTo("TABLE");
        assertThat(table.header().getString("EXTNAME")).isEqualTo("CATALOG");
        assertThat(table.header().getString("TTYPE2")).isEqualTo("COUNT");
        AsciiTable decoded = ((Extension.AsciiTableData) table.data()).table();
        assertThat(decoded.targetRowCount()).isEqualTo(5);
        assertThat(decoded.textColumn(0).values()).containsExactly("M31", "M33", "NGC 253", "NGC 4594", "IC 342");
        assertThat(decoded.intColumn(1).values()).containsExactly(0L, 10L, null, 30L, 40L);
        assertThat(decoded.floatColumn(2).values()).containsExactly(1.25, 2.5, 3.75, 5.0, 6.25);

        Extension.BinTableData bin = (Extension.BinTableData) hdus.get(2).data();
        assertThat(bin.rowWidth()).isEqualTo(3);
        assertThat(bin.rowCount()).isEqualTo(2);
        assertThat(bin.data()).containsExactly(binTable);
    }

    @Test
    void testInsertsEmptyPrimaryBeforeLeadingTable() throws Exception {
        Path file = tempDir.resolve("table-only.fits");

        FitsFileWriter.writeAll(file, List.of(new Hdu(new FitsHeader(), new Extension.AsciiTableData(catalog()))));

        List<Hdu> hdus = FitsFileReader.readAll(file, context);
        assertThat(hdus).hasSize(2);
        assertThat(hdus.get(0).isPrimary()).isTrue();
        assertThat(hdus.get(0).hasData()).isFalse();
        assertThat(hdus.get(0).header().getBoolean("EXTEND", false)).isTrue();
        assertThat(hdus.get(1).data()).isInstanceOf(Extension.AsciiTableData.class);
    }

    @Test
    void testUnknownExtensionTypeIsFormatError() throws Exception {
        Path file = tempDir.resolve("foreign.fits");
        FitsFileWriter.writeAll(file, List.of(
                new Hdu(new FitsHeader(), null),
                new Hdu(new FitsHeader().add(HeaderCard.of("EXTNAME", "X")), new Extension.ImageData(
                        TypedImage.of(new byte[]{ 1, 2 }, 2)))));

        byte[] bytes = Files.readAllBytes(file);
        byte[] foreign = "XTENSION= 'FOREIGN '".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(foreign, 0, bytes, Blocks.BLOCK_SIZE, foreign.length);
        Files.write(file, bytes);

        assertThatThrownBy(() -> FitsFileReader.readAll(file, context))
                .isInstanceOf(FitsFormatException.class)
                .hasMessageContaining("Unsupported extension type 'FOREIGN'");
    }

    @Test
    void testRandomGroupsOutsidePrimaryAreRejected() {
        Path file = tempDir.resolve("bad.fits");

        assertThatThrownBy(() -> FitsFileWriter.writeAll(file, List.of(
                new Hdu(new FitsHeader(), null),
                new Hdu(new FitsHeader(), new Extension.RandomGroupsData(
                        Bitpix.SHORT, 1, 0, new long[]{ 2 }, new byte[4])))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Random groups");
    }
}
