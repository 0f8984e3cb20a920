/*
 * ScriptedInputStream.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of smtplike, a server engine for SMTP-style line
 * protocols.
 *
 * smtplike is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * smtplike is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with smtplike.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.smtplike;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Input stream that delivers a scripted series of chunks, one chunk (or
 * less) per read, and then either reports end of stream or fails.
 */
class ScriptedInputStream extends InputStream {

    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private byte[] current;
    private int pos;
    private IOException failure;

    int reads;
    boolean closed;

    ScriptedInputStream chunk(String text) {
        chunks.add(text.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    ScriptedInputStream chunk(byte[] bytes) {
        chunks.add(bytes);
        return this;
    }

    ScriptedInputStream failWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public int read() throws IOException {
        byte[] b = new byte[1];
        int n = read(b, 0, 1);
        return (n < 0) ? -1 : (b[0] & 0xff);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        reads++;
        if (current == null || pos == current.length) {
            current = chunks.poll();
            pos = 0;
            if (current == null) {
                if (failure != null) {
                    throw failure;
                }
                return -1;
            }
        }
        int n = Math.min(len, current.length - pos);
        System.arraycopy(current, pos, b, off, n);
        pos += n;
        return n;
    }

    @Override
    public void close() {
        closed = true;
    }

}
