/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.io;

/**
 * Block arithmetic. FITS files are a sequence of 2880 byte blocks; every
 * header and payload starts on a block boundary.
 */
public final class Blocks {

    public static final int BLOCK_SIZE = 2880;

    private Blocks() {
        // Utility class
    }

    /** Number of blocks needed to hold the given number of bytes. */
    public static long blockCount(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Negative byte count: " + bytes);
        }
        return (bytes + BLOCK_SIZE - 1) / BLOCK_SIZE;
    }

    /** The given byte count rounded up to the next block boundary. */
    public static long paddedLength(long bytes) {
        return blockCount(bytes) * BLOCK_SIZE;
    }

    public static boolean isAligned(long bytes) {
        return bytes % BLOCK_SIZE == 0;
    }

    /**
     * Returns the padded length as an array size, failing if the payload is too
     * large to be held in memory as one array.
     */
    public static int paddedArrayLength(long bytes) {
        long padded = paddedLength(bytes);
        if (padded > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Payload of " + bytes + " bytes exceeds the maximum array size");
        }
        return (int) padded;
    }
}
