/*
 * FailingOutputStream.java
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
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Output stream that accepts a number of writes and then fails.
 */
class FailingOutputStream extends OutputStream {

    private final ByteArrayOutputStream sent = new ByteArrayOutputStream();
    private final IOException failure;
    private int writesLeft;

    FailingOutputStream(int successfulWrites, IOException failure) {
        this.writesLeft = successfulWrites;
        this.failure = failure;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] { (byte) b }, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (writesLeft == 0) {
            throw failure;
        }
        writesLeft--;
        sent.write(b, off, len);
    }

    String output() {
        return new String(sent.toByteArray(), StandardCharsets.UTF_8);
    }

}
