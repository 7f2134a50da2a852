/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Parquet {@link InputFile} over a local path, read through a {@link FileChannel}
 * so no Hadoop filesystem is involved.
 */
public final class NioInputFile implements InputFile {

    private final Path path;

    public NioInputFile(Path path) {
        this.path = path;
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(path);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelInputStream(FileChannel.open(path, StandardOpenOption.READ));
    }

    @Override
    public String toString() {
        return path.toString();
    }

    /**
     * Positional reads; {@link #seek(long)} only moves the cursor.
     */
    private static final class ChannelInputStream extends SeekableInputStream {
        private final FileChannel channel;
        private long pos;

        ChannelInputStream(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public int read() throws IOException {
            final ByteBuffer one = ByteBuffer.allocate(1);
            final int n = channel.read(one, pos);
            if (n <= 0) return -1;
            pos += n;
            return one.get(0) & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return read(ByteBuffer.wrap(b, off, len));
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            final int n = channel.read(dst, pos);
            if (n > 0) pos += n;
            return n;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(ByteBuffer.wrap(bytes));
        }

        @Override
        public void readFully(byte[] bytes, int off, int len) throws IOException {
            readFully(ByteBuffer.wrap(bytes, off, len));
        }

        @Override
        public void readFully(ByteBuffer dst) throws IOException {
            while (dst.hasRemaining()) {
                if (read(dst) < 0) {
                    throw new EOFException("Unexpected end of parquet file at offset " + pos);
                }
            }
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void seek(long newPos) {
            this.pos = newPos;
        }

        @Override
        public int available() throws IOException {
            final long remaining = channel.size() - pos;
            return (int) Math.max(0, Math.min(Integer.MAX_VALUE, remaining));
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
