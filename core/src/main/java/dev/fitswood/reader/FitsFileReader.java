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

import dev.fitswood.hdu.Hdu;
import dev.fitswood.hdu.HduReader;
import dev.fitswood.internal.io.BlockReader;

/**
 * Reads all HDUs of a FITS file.
 *
 * <pre>{@code
 * List<Hdu> hdus = FitsFileReader.readAll(path);
 * }</pre>
 *
 * <p>For reading many files with a shared thread pool, pass a {@link FitsContext}.
 * The file is open only for the duration of the call.</p>
 */
public final class FitsFileReader {

    private static final System.Logger LOG = System.getLogger(FitsFileReader.class.getName());

    private FitsFileReader() {
        // Utility class
    }

    /**
     * Read a FITS file with a dedicated context, which is closed afterwards.
     */
    public static List<Hdu> readAll(Path path) throws IOException {
        try (FitsContext context = FitsContext.create()) {
            return readAll(path, context);
        }
    }

    /**
     * Read a FITS file with a shared context. The context is NOT closed.
     */
    public static List<Hdu> readAll(Path path, FitsContext context) throws IOException {
        try (BlockReader reader = BlockReader.open(path)) {
            return readAll(reader, context);
        }
    }

    /**
     * Read HDUs from the given reader until it is exhausted.
     */
    public static List<Hdu> readAll(BlockReader reader, FitsContext context) throws IOException {
        LOG.log(System.Logger.Level.DEBUG, "Starting to read ''{0}''", reader.source());

        List<Hdu> hdus = new ArrayList<>();
        while (!reader.atEnd()) {
            hdus.add(HduReader.read(reader, context));
        }

        LOG.log(System.Logger.Level.DEBUG, "Read {0} HDUs ({1} bytes) from ''{2}''",
                hdus.size(), reader.position(), reader.source());
        return hdus;
    }
}
