/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.internal.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Writes a FITS byte stream in whole blocks. Counterpart of {@link BlockReader}.
 */
public final class BlockWriter implements Closeable {

    private final WritableByteChannel channel;
    private final String target;
    private long position;

    public BlockWriter(WritableByteChannel channel, String target) {
        this.channel = channel;
        this.target = target;
    }

    public static BlockWriter create(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
        return new BlockWriter(channel, path.toString());
    }

    public static BlockWriter of(OutputStream out) {
        return new BlockWriter(Channels.newChannel(out), "stream");
    }

    /**
     * Writes the given buffer, which must be a multiple of the block size.
     */
    public void writeBlocks(byte[] buffer) throws IOException {
        if (!Blocks.isAligned(buffer.length)) {
            throw new IOException("Write of " + buffer.length + " bytes is not a multiple of the block size "
                    + Blocks.BLOCK_SIZE + " (" + target + ")");
        }
        ByteBuffer source = ByteBuffer.wrap(buffer);
        while (source.hasRemaining()) {
            channel.write(source);
        }
        position += buffer.length;
    }

    /**
     * Writes content of arbitrary length, filling the last block with the given byte.
     */
    public void writePadded(byte[] content, byte fill) throws IOException {
        if (Blocks.isAligned(content.length)) {
            writeBlocks(content);
            return;
        }
        byte[] padded = Arrays.copyOf(content, Blocks.paddedArrayLength(content.length));
        Arrays.fill(padded, content.length, padded.length, fill);
        writeBlocks(padded);
    }

    /** Number of bytes written so far. */
    public long position() {
        return position;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
