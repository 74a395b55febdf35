/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.io;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads a FITS byte stream in whole blocks.
 * <p>
 * All reads are multiples of {@link Blocks#BLOCK_SIZE}. A read that cannot be
 * satisfied completely fails with an {@link EOFException}; partial content is
 * never returned. The reader only moves forward.
 * </p>
 */
public final class BlockReader implements Closeable {

    private final ReadableByteChannel channel;
    private final String source;
    private long position;
    private boolean endReached;
    private int lookahead = -1;

    public BlockReader(ReadableByteChannel channel, String source) {
        this.channel = channel;
        this.source = source;
    }

    public static BlockReader open(Path path) throws IOException {
        return new BlockReader(FileChannel.open(path, StandardOpenOption.READ), path.toString());
    }

    public static BlockReader of(InputStream in) {
        return new BlockReader(Channels.newChannel(in), "stream");
    }

    /**
     * Fills the given buffer completely with the next bytes of the stream.
     *
     * @throws IOException if the buffer is not block aligned or the stream fails
     * @throws EOFException if the stream ends before the buffer is full
     */
    public void readBlocks(byte[] buffer) throws IOException {
        if (!Blocks.isAligned(buffer.length)) {
            throw new IOException("Read of " + buffer.length + " bytes is not a multiple of the block size "
                    + Blocks.BLOCK_SIZE + " (" + source + ")");
        }
        ByteBuffer target = ByteBuffer.wrap(buffer);
        if (lookahead >= 0 && buffer.length > 0) {
            target.put((byte) lookahead);
            lookahead = -1;
        }
        while (target.hasRemaining()) {
            int read = channel.read(target);
            if (read < 0) {
                endReached = true;
                throw new EOFException("Expected " + buffer.length + " bytes at offset " + position
                        + " but only " + target.position() + " are available (" + source + ")");
            }
        }
        position += buffer.length;
    }

    /**
     * Reads the given number of whole blocks into a new array.
     */
    public byte[] readBlocks(long blockCount) throws IOException {
        byte[] buffer = new byte[Blocks.paddedArrayLength(blockCount * Blocks.BLOCK_SIZE)];
        readBlocks(buffer);
        return buffer;
    }

    /**
     * Discards the given number of blocks, e.g. for payloads that are not decoded.
     */
    public void skipBlocks(long blockCount) throws IOException {
        byte[] block = new byte[Blocks.BLOCK_SIZE];
        for (long i = 0; i < blockCount; i++) {
            readBlocks(block);
        }
    }

    /**
     * Whether the stream is exhausted. Probes the channel for a single byte when
     * no read has hit the end yet; the probed byte is kept for the next read.
     */
    public boolean atEnd() throws IOException {
        if (endReached) {
            return true;
        }
        if (lookahead >= 0) {
            return false;
        }
        if (channel instanceof FileChannel fileChannel) {
            endReached = fileChannel.position() >= fileChannel.size();
            return endReached;
        }
        ByteBuffer probe = ByteBuffer.allocate(1);
        int read = 0;
        while (read == 0) {
            read = channel.read(probe);
        }
        if (read < 0) {
            endReached = true;
        }
        else {
            lookahead = probe.get(0) & 0xFF;
        }
        return endReached;
    }

    /** Byte offset of the next read from the start of the stream. */
    public long position() {
        return position;
    }

    public String source() {
        return source;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
