/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.hdu;

import java.io.IOException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import dev.fitswood.image.TypedImage;
import dev.fitswood.internal.header.HeaderCodec;
import dev.fitswood.internal.image.ImageCodec;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.table.AsciiTableCodec;
import dev.fitswood.metadata.Bitpix;
import dev.fitswood.metadata.FitsHeader;
import dev.fitswood.metadata.HeaderCard;

/**
 * Writes one HDU. The structural keywords ({@code SIMPLE}/{@code XTENSION},
 * {@code BITPIX}, {@code NAXISn}, ...) are derived from the payload and placed
 * in the mandatory order; all other cards of the given header follow as they are.
 * <p>
 * ASCII tables are consumed: they are rendered before the header is written,
 * since their final layout determines {@code NAXIS1}, {@code TBCOLn} and {@code TFORMn}.
 * </p>
 */
public final class HduWriter {

    private static final System.Logger LOG = System.getLogger(HduWriter.class.getName());

    private static final Set<String> STRUCTURAL = Set.of("SIMPLE", "XTENSION", "BITPIX", "NAXIS", "PCOUNT", "GCOUNT",
            "GROUPS", "END");
    private static final Pattern AXIS = Pattern.compile("NAXIS\\d+");
    private static final Pattern ASCII_TABLE_LAYOUT = Pattern.compile("TFIELDS|TBCOL\\d+|TFORM\\d+|TTYPE\\d+");
    private static final Predicate<String> STRUCTURAL_KEYWORD =
            keyword -> STRUCTURAL.contains(keyword) || AXIS.matcher(keyword).matches();

    private HduWriter() {
        // Utility class
    }

    public static void write(BlockWriter writer, Hdu hdu, boolean primary) throws IOException {
        long offset = writer.position();
        Extension data = hdu.data();

        if (data == null) {
            FitsHeader header = structure(primary, Bitpix.BYTE, new long[0]);
            HeaderCodec.write(merge(header, hdu.header(), STRUCTURAL_KEYWORD), writer);
        }
        else if (data instanceof Extension.ImageData imageData) {
            TypedImage image = imageData.image();
            FitsHeader header = structure(primary, image.bitpix(), image.shape());
            HeaderCodec.write(merge(header, hdu.header(), STRUCTURAL_KEYWORD), writer);
            ImageCodec.encode(image, writer);
        }
        else if (data instanceof Extension.AsciiTableData tableData) {
            requireExtension(primary, "An ASCII table");
            AsciiTableCodec.EncodedTable encoded = AsciiTableCodec.render(tableData.table());
            FitsHeader header = new FitsHeader()
                    .add(HeaderCard.of("XTENSION", "TABLE", "ASCII table extension"))
                    .add(HeaderCard.of("BITPIX", 8))
                    .add(HeaderCard.of("NAXIS", 2))
                    .add(HeaderCard.of("NAXIS1", encoded.layout().rowWidth()))
                    .add(HeaderCard.of("NAXIS2", encoded.layout().rowCount()))
                    .add(HeaderCard.of("PCOUNT", 0))
                    .add(HeaderCard.of("GCOUNT", 1));
            encoded.layout().applyTo(header);
            HeaderCodec.write(merge(header, hdu.header(),
                    STRUCTURAL_KEYWORD.or(keyword -> ASCII_TABLE_LAYOUT.matcher(keyword).matches())), writer);
            writer.writePadded(encoded.data(), (byte) ' ');
        }
        else if (data instanceof Extension.BinTableData binTable) {
            requireExtension(primary, "A binary table");
            FitsHeader header = new FitsHeader()
                    .add(HeaderCard.of("XTENSION", "BINTABLE", "binary table extension"))
                    .add(HeaderCard.of("BITPIX", 8))
                    .add(HeaderCard.of("NAXIS", 2))
                    .add(HeaderCard.of("NAXIS1", binTable.rowWidth()))
                    .add(HeaderCard.of("NAXIS2", binTable.rowCount()))
                    .add(HeaderCard.of("PCOUNT", binTable.heapSize()))
                    .add(HeaderCard.of("GCOUNT", 1));
            HeaderCodec.write(merge(header, hdu.header(), STRUCTURAL_KEYWORD), writer);
            writer.writePadded(binTable.data(), (byte) 0);
        }
        else if (data instanceof Extension.RandomGroupsData groups) {
            if (!primary) {
                throw new IllegalArgumentException("Random groups can only be stored in the primary HDU");
            }
            FitsHeader header = new FitsHeader()
                    .add(HeaderCard.of("SIMPLE", true, "conforms to FITS standard"))
                    .add(HeaderCard.of("BITPIX", groups.bitpix().code()))
                    .add(HeaderCard.of("NAXIS", groups.groupShape().length + 1))
                    .add(HeaderCard.of("NAXIS1", 0));
            for (int i = 0; i < groups.groupShape().length; i++) {
                header.add(HeaderCard.of("NAXIS" + (i + 2), groups.groupShape()[i]));
            }
            header.add(HeaderCard.of("GROUPS", true))
                    .add(HeaderCard.of("PCOUNT", groups.parameterCount()))
                    .add(HeaderCard.of("GCOUNT", groups.groupCount()));
            HeaderCodec.write(merge(header, hdu.header(), STRUCTURAL_KEYWORD), writer);
            writer.writePadded(groups.data(), (byte) 0);
        }

        LOG.log(System.Logger.Level.DEBUG, "Wrote HDU at offset {0} ({1} bytes)", offset, writer.position() - offset);
    }

    private static FitsHeader structure(boolean primary, Bitpix bitpix, long[] shape) {
        FitsHeader header = new FitsHeader();
        if (primary) {
            header.add(HeaderCard.of("SIMPLE", true, "conforms to FITS standard"));
        }
        else {
            header.add(HeaderCard.of("XTENSION", "IMAGE", "image extension"));
        }
        header.add(HeaderCard.of("BITPIX", bitpix.code()))
                .add(HeaderCard.of("NAXIS", shape.length));
        for (int i = 0; i < shape.length; i++) {
            header.add(HeaderCard.of("NAXIS" + (i + 1), shape[i]));
        }
        if (!primary) {
            header.add(HeaderCard.of("PCOUNT", 0))
                    .add(HeaderCard.of("GCOUNT", 1));
        }
        return header;
    }

    /** Appends the cards of {@code source} that are not derived to {@code target}. */
    private static FitsHeader merge(FitsHeader target, FitsHeader source, Predicate<String> derived) {
        for (HeaderCard card : source.cards()) {
            if (!derived.test(card.keyword())) {
                target.add(card);
            }
        }
        return target;
    }

    private static void requireExtension(boolean primary, String what) {
        if (primary) {
            throw new IllegalArgumentException(what + " cannot be stored in the primary HDU");
        }
    }
}
