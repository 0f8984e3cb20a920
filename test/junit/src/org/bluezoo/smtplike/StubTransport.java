/*
 * StubTransport.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Transport over in-memory streams that records what was sent and how
 * often it was closed.
 */
class StubTransport implements Transport {

    final ScriptedInputStream in;
    final ByteArrayOutputStream sent = new ByteArrayOutputStream();
    private final OutputStream out;
    int closeCount;

    StubTransport(ScriptedInputStream in) {
        this.in = in;
        this.out = sent;
    }

    StubTransport(ScriptedInputStream in, OutputStream out) {
        this.in = in;
        this.out = out;
    }

    static StubTransport of(String... chunks) {
        ScriptedInputStream in = new ScriptedInputStream();
        for (String chunk : chunks) {
            in.chunk(chunk);
        }
        return new StubTransport(in);
    }

    String output() {
        return new String(sent.toByteArray(), StandardCharsets.UTF_8);
    }

    @Override
    public InputStream getInputStream() {
        return in;
    }

    @Override
    public OutputStream getOutputStream() {
        return out;
    }

    @Override
    public SocketAddress getLocalAddress() {
        return null;
    }

    @Override
    public SocketAddress getRemoteAddress() {
        return null;
    }

    @Override
    public void close() {
        closeCount++;
    }

    @Override
    public String toString() {
        return "StubTransport";
    }

}
