/*
 * ReplyEncoder.java
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
import java.io.OutputStream;
import java.nio.charset.Charset;

/**
 * Encodes replies into their wire form.
 *
 * <p>A message of N lines becomes N CRLF-terminated wire lines, each
 * prefixed with the status code zero-padded to three digits. The first
 * N-1 lines use a hyphen as separator and the last line a space:
 * <pre>
 * 250-a
 * 250-b
 * 250 c
 * </pre>
 * An empty message is a single empty line ({@code "250 \r\n"}).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ReplyEncoder {

    private static final String CRLF = "\r\n";

    private ReplyEncoder() {
    }

    /**
     * Returns the wire form of a reply as text.
     *
     * @param code the status code
     * @param message the message, lines separated by {@code '\n'}
     * @return the CRLF-terminated reply lines
     */
    public static String format(int code, String message) {
        String[] lines = (message == null) ? new String[] { "" } : message.split("\n", -1);
        String prefix = String.format("%03d", code);
        StringBuilder buf = new StringBuilder();
        int last = lines.length - 1;
        for (int i = 0; i < last; i++) {
            buf.append(prefix).append('-').append(lines[i]).append(CRLF);
        }
        buf.append(prefix).append(' ').append(lines[last]).append(CRLF);
        return buf.toString();
    }

    /**
     * Encodes a reply using the given charset.
     *
     * @param reply the reply
     * @param charset the charset for the message text
     * @return the encoded bytes
     */
    public static byte[] encode(Reply reply, Charset charset) {
        return format(reply.getCode(), reply.getMessage()).getBytes(charset);
    }

    /**
     * Writes a reply to the given stream in a single write.
     *
     * @param out the stream to the client
     * @param reply the reply
     * @param charset the charset for the message text
     * @throws IOException if the write fails
     */
    public static void send(OutputStream out, Reply reply, Charset charset) throws IOException {
        out.write(encode(reply, charset));
        out.flush();
    }

}
