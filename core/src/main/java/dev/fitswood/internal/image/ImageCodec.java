/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.image;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import dev.fitswood.FitsFormatException;
import dev.fitswood.image.TypedImage;
import dev.fitswood.internal.io.BlockReader;
import dev.fitswood.internal.io.BlockWriter;
import dev.fitswood.internal.io.Blocks;
import dev.fitswood.metadata.Bitpix;

/**
 * Decodes and encodes FITS image payloads. Elements are stored big-endian in
 * column-major order; the order is kept as is, no transposition takes place.
 */
public final class ImageCodec {

    private static final System.Logger LOG = System.getLogger(ImageCodec.class.getName());

    private ImageCodec() {
        // Utility class
    }

    /**
     * Reads an image payload of the given type and shape, including the padding
     * up to the next block boundary.
     */
    public static TypedImage decode(BlockReader reader, Bitpix bitpix, long[] shape) throws IOException {
        long count = elementCount(shape);
        long byteLength = count * bitpix.byteWidth();
        int elements = (int) count;

        LOG.log(System.Logger.Level.DEBUG, "Decoding {0} image with shape {1} ({2} bytes)",
                bitpix, Arrays.toString(shape), byteLength);

        byte[] raw;
        try {
            raw = new byte[Blocks.paddedArrayLength(byteLength)];
        }
        catch (IllegalArgumentException e) {
            throw new FitsFormatException("Image with shape " + Arrays.toString(shape) + " is too large to decode", e);
        }
        reader.readBlocks(raw);

        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.BIG_ENDIAN);
        return switch (bitpix) {
            case BYTE -> TypedImage.of(Arrays.copyOf(raw, elements), shape);
            case SHORT -> {
                short[] data = new short[elements];
                buffer.asShortBuffer().get(data);
                yield TypedImage.of(data, shape);
            }
            case INT -> {
                int[] data = new int[elements];
                buffer.asIntBuffer().get(data);
                yield TypedImage.of(data, shape);
            }
            case LONG -> {
                long[] data = new long[elements];
                buffer.asLongBuffer().get(data);
                yield TypedImage.of(data, shape);
            }
            case FLOAT -> {
                float[] data = new float[elements];
                buffer.asFloatBuffer().get(data);
                yield TypedImage.of(data, shape);
            }
            case DOUBLE -> {
                double[] data = new double[elements];
                buffer.asDoubleBuffer().get(data);
                yield TypedImage.of(data, shape);
            }
        };
    }

    /**
     * Writes the image as big-endian elements, zero-padded to the block boundary.
     * The image is read through its views and stays usable.
     */
    public static void encode(TypedImage image, BlockWriter writer) throws IOException {
        byte[] raw = new byte[Blocks.paddedArrayLength(image.blockLength())];
        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.BIG_ENDIAN);
        switch (image.bitpix()) {
            case BYTE -> buffer.put(image.asBytes());
            case SHORT -> buffer.asShortBuffer().put(image.asShorts());
            case INT -> buffer.asIntBuffer().put(image.asInts());
            case LONG -> buffer.asLongBuffer().put(image.asLongs());
            case FLOAT -> buffer.asFloatBuffer().put(image.asFloats());
            case DOUBLE -> buffer.asDoubleBuffer().put(image.asDoubles());
        }

        LOG.log(System.Logger.Level.DEBUG, "Encoded {0} ({1} bytes)", image, image.blockLength());
        writer.writeBlocks(raw);
    }

    private static long elementCount(long[] shape) throws FitsFormatException {
        long count = 1;
        for (long axis : shape) {
            if (axis <= 0) {
                throw new FitsFormatException("Invalid image axis length " + axis + " in " + Arrays.toString(shape));
            }
            try {
                count = Math.multiplyExact(count, axis);
            }
            catch (ArithmeticException e) {
                throw new FitsFormatException("Image with shape " + Arrays.toString(shape) + " is too large", e);
            }
        }
        if (count > Integer.MAX_VALUE - 8) {
            throw new FitsFormatException("Image with shape " + Arrays.toString(shape) + " has too many elements to decode");
        }
        return count;
    }
}
