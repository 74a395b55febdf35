/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import dev.fitswood.hdu.Extension;
import dev.fitswood.hdu.Hdu;
import dev.fitswood.hdu.HduWriter;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.metadata.HeaderCard;

/**
 * Writes HDUs to a FITS file in the given order. The first HDU becomes the
 * primary HDU; if it holds a table, an empty primary HDU is written before it.
 * ASCII tables are consumed while writing.
 */
public final class FitsFileWriter {

    private static final System.Logger LOG = System.getLogger(FitsFileWriter.class.getName());

    private FitsFileWriter() {
        // Utility class
    }

    public static void writeAll(Path path, List<Hdu> hdus) throws IOException {
        try (BlockWriter writer = BlockWriter.create(path)) {
            writeAll(writer, hdus);
        }
    }

    public static void writeAll(BlockWriter writer, List<Hdu> hdus) throws IOException {
        List<Hdu> toWrite = new ArrayList<>(hdus);
        if (toWrite.isEmpty() || needsEmptyPrimary(toWrite.get(0))) {
            FitsHeader header = new FitsHeader();
            if (!toWrite.isEmpty()) {
                header.add(HeaderCard.of("EXTEND", true, "file contains extensions"));
            }
            toWrite.add(0, new Hdu(header, null));
        }

        for (int i = 0; i < toWrite.size(); i++) {
            HduWriter.write(writer, toWrite.get(i), i == 0);
        }
        LOG.log(System.Logger.Level.DEBUG, "Wrote {0} HDUs ({1} bytes)", toWrite.size(), writer.position());
    }

    private static boolean needsEmptyPrimary(Hdu first) {
        Extension data = first.data();
        return data instanceof Extension.AsciiTableData || data instanceof Extension.BinTableData;
    }
}
