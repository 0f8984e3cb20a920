/*
 * Transport.java
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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;

/**
 * Bidirectional byte stream a session runs over.
 *
 * <p>This is the only view the engine has of a connection. Usually it is a
 * TCP socket ({@link SocketTransport}), but any pair of streams will do
 * ({@link StreamTransport}). Timeouts, encryption and the like are
 * properties of the transport and invisible to the engine: a read timeout,
 * for example, simply surfaces as an {@link IOException} from the input
 * stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Session
 */
public interface Transport extends Closeable {

    /**
     * Returns the stream of bytes from the client.
     *
     * @return the input stream
     * @throws IOException if the stream cannot be obtained
     */
    InputStream getInputStream() throws IOException;

    /**
     * Returns the stream of bytes to the client.
     *
     * @return the output stream
     * @throws IOException if the stream cannot be obtained
     */
    OutputStream getOutputStream() throws IOException;

    /**
     * Returns the local address of this transport.
     *
     * @return the local address, or null if not applicable
     */
    SocketAddress getLocalAddress();

    /**
     * Returns the address of the client.
     *
     * @return the remote address, or null if not applicable
     */
    SocketAddress getRemoteAddress();

    /**
     * Closes the transport. The engine calls this exactly once per session.
     *
     * @throws IOException if closing fails
     */
    @Override
    void close() throws IOException;

}
