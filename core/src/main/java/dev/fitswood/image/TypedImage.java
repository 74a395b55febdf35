/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.image;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Arrays;

import dev.fitswood.metadata.Bitpix;

/**
 * An N-dimensional FITS image holding elements of exactly one {@link Bitpix} type.
 * <p>
 * Elements are kept in a flat primitive array in the column-major order
 * mandated by FITS: the first axis ({@code NAXIS1}) varies fastest. The shape
 * is fixed at construction. There is no conversion between element types;
 * accessors for a type other than the stored one throw
 * {@link ImageTypeMismatchException}.
 * </p>
 * <p>
 * The {@code as*} accessors return read-only views of the data. The
 * {@code take*} accessors hand over the backing array and consume the image,
 * whether the requested type matches or not; any later access fails with
 * {@link IllegalStateException}.
 * </p>
 */
public abstract sealed class TypedImage
        permits TypedImage.ByteImage, TypedImage.ShortImage, TypedImage.IntImage,
        TypedImage.LongImage, TypedImage.FloatImage, TypedImage.DoubleImage {

    private final long[] shape;
    private boolean consumed;

    private TypedImage(long[] shape, int length) {
        if (shape.length == 0) {
            throw new IllegalArgumentException("An image needs at least one axis");
        }
        long count = 1;
        for (long axis : shape) {
            if (axis <= 0) {
                throw new IllegalArgumentException("Invalid axis length " + axis + " in shape " + Arrays.toString(shape));
            }
            count = Math.multiplyExact(count, axis);
        }
        if (count != length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " describes " + count
                    + " elements but " + length + " were given");
        }
        this.shape = shape.clone();
    }

    public static ByteImage of(byte[] data, long... shape) {
        return new ByteImage(data, shape);
    }

    public static ShortImage of(short[] data, long... shape) {
        return new ShortImage(data, shape);
    }

    public static IntImage of(int[] data, long... shape) {
        return new IntImage(data, shape);
    }

    public static LongImage of(long[] data, long... shape) {
        return new LongImage(data, shape);
    }

    public static FloatImage of(float[] data, long... shape) {
        return new FloatImage(data, shape);
    }

    public static DoubleImage of(double[] data, long... shape) {
        return new DoubleImage(data, shape);
    }

    public abstract Bitpix bitpix();

    /** The backing array; only called while the image is not consumed. */
    abstract Object array();

    abstract void release();

    /** Axis lengths, {@code NAXIS1} first. */
    public long[] shape() {
        return shape.clone();
    }

    public int dimensions() {
        return shape.length;
    }

    public long elementCount() {
        long count = 1;
        for (long axis : shape) {
            count *= axis;
        }
        return count;
    }

    /**
     * Number of payload bytes, i.e. element count times element width. Rounding
     * up to the block boundary is left to the writer.
     */
    public long blockLength() {
        return elementCount() * bitpix().byteWidth();
    }

    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Position of the element with the given (zero based) index in the flat
     * column-major array.
     */
    public int offsetOf(long... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices but got " + index.length);
        }
        long offset = 0;
        long stride = 1;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("Index " + index[axis] + " out of bounds for axis " + (axis + 1)
                        + " of length " + shape[axis]);
            }
            offset += index[axis] * stride;
            stride *= shape[axis];
        }
        return (int) offset;
    }

    public ByteBuffer asBytes() {
        return ByteBuffer.wrap((byte[]) borrow(Bitpix.BYTE)).asReadOnlyBuffer();
    }

    public ShortBuffer asShorts() {
        return ShortBuffer.wrap((short[]) borrow(Bitpix.SHORT)).asReadOnlyBuffer();
    }

    public IntBuffer asInts() {
        return IntBuffer.wrap((int[]) borrow(Bitpix.INT)).asReadOnlyBuffer();
    }

    public LongBuffer asLongs() {
        return LongBuffer.wrap((long[]) borrow(Bitpix.LONG)).asReadOnlyBuffer();
    }

    public FloatBuffer asFloats() {
        return FloatBuffer.wrap((float[]) borrow(Bitpix.FLOAT)).asReadOnlyBuffer();
    }

    public DoubleBuffer asDoubles() {
        return DoubleBuffer.wrap((double[]) borrow(Bitpix.DOUBLE)).asReadOnlyBuffer();
    }

    public byte[] takeBytes() {
        return (byte[]) take(Bitpix.BYTE);
    }

    public short[] takeShorts() {
        return (short[]) take(Bitpix.SHORT);
    }

    public int[] takeInts() {
        return (int[]) take(Bitpix.INT);
    }

    public long[] takeLongs() {
        return (long[]) take(Bitpix.LONG);
    }

    public float[] takeFloats() {
        return (float[]) take(Bitpix.FLOAT);
    }

    public double[] takeDoubles() {
        return (double[]) take(Bitpix.DOUBLE);
    }

    private Object borrow(Bitpix requested) {
        checkNotConsumed();
        if (bitpix() != requested) {
            throw new ImageTypeMismatchException(bitpix(), requested);
        }
        return array();
    }

    private Object take(Bitpix requested) {
        checkNotConsumed();
        Object array = array();
        consumed = true;
        release();
        if (bitpix() != requested) {
            throw new ImageTypeMismatchException(bitpix(), requested);
        }
        return array;
    }

    void checkNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("Image data has already been taken");
        }
    }

    @Override
    public String toString() {
        return "TypedImage(" + bitpix().elementTypeName() + ", shape=" + Arrays.toString(shape)
                + (consumed ? ", consumed" : "") + ")";
    }

    public static final class ByteImage extends TypedImage {

        private byte[] data;

        private ByteImage(byte[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.BYTE;
        }

        /** FITS bytes are unsigned. */
        public int getUnsigned(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)] & 0xFF;
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }

    public static final class ShortImage extends TypedImage {

        private short[] data;

        private ShortImage(short[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.SHORT;
        }

        public short get(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)];
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }

    public static final class IntImage extends TypedImage {

        private int[] data;

        private IntImage(int[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.INT;
        }

        public int get(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)];
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }

    public static final class LongImage extends TypedImage {

        private long[] data;

        private LongImage(long[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.LONG;
        }

        public long get(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)];
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }

    public static final class FloatImage extends TypedImage {

        private float[] data;

        private FloatImage(float[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.FLOAT;
        }

        public float get(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)];
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }

    public static final class DoubleImage extends TypedImage {

        private double[] data;

        private DoubleImage(double[] data, long[] shape) {
            super(shape, data.length);
            this.data = data;
        }

        @Override
        public Bitpix bitpix() {
            return Bitpix.DOUBLE;
        }

        public double get(long... index) {
            checkNotConsumed();
            return data[offsetOf(index)];
        }

        @Override
        Object array() {
            return data;
        }

        @Override
        void release() {
            data = null;
        }
    }
}
