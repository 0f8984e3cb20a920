/*
 * LineReader.java
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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * Buffered reader of LF-terminated lines.
 *
 * <p>Unlike {@link java.io.BufferedReader#readLine()}, lines are returned
 * with their terminator (LF, or CRLF if the client sent one), since body
 * lines read by {@link Session#readBody(int, String, String)} are passed
 * on unmodified. Lines are split on the LF byte before being decoded, so
 * any charset in which LF is a single byte that appears in no other
 * character (US-ASCII, ISO-8859-1, UTF-8) may be used.
 *
 * <p>Lines may be of any length.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LineReader {

    private static final byte LF = (byte) '\n';
    private static final int BUFFER_SIZE = 4096;

    private final InputStream in;
    private final Charset charset;

    private final byte[] buf = new byte[BUFFER_SIZE];
    private int pos;
    private int limit;

    private byte[] line = new byte[BUFFER_SIZE];
    private int lineLength;

    /**
     * Creates a line reader.
     *
     * @param in the underlying stream
     * @param charset the charset used to decode lines
     */
    public LineReader(InputStream in, Charset charset) {
        this.in = in;
        this.charset = charset;
    }

    /**
     * Reads the next line, including its terminator.
     *
     * <p>If the stream ends before a terminator is seen, any partial line
     * is discarded and an {@link EOFException} is thrown.
     *
     * @return the line, ending with {@code '\n'}
     * @throws EOFException if the stream ends before a complete line
     * @throws IOException if reading fails
     */
    public String readLine() throws IOException {
        lineLength = 0;
        while (true) {
            if (pos == limit) {
                fill();
            }
            int start = pos;
            while (pos < limit) {
                if (buf[pos++] == LF) {
                    append(start, pos);
                    String result = new String(line, 0, lineLength, charset);
                    lineLength = 0;
                    return result;
                }
            }
            append(start, pos);
        }
    }

    private void fill() throws IOException {
        int n = in.read(buf, 0, buf.length);
        if (n < 0) {
            int discarded = lineLength;
            lineLength = 0;
            if (discarded > 0) {
                throw new EOFException("Connection closed after partial line of " + discarded + " bytes");
            }
            throw new EOFException("Connection closed");
        }
        pos = 0;
        limit = n;
    }

    private void append(int start, int end) {
        int n = end - start;
        if (lineLength + n > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + n));
        }
        System.arraycopy(buf, start, line, lineLength, n);
        lineLength += n;
    }

}
