/*
 * BodyReadException.java
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
import java.util.Collections;
import java.util.List;

/**
 * Thrown when the connection fails while a handler is reading a body with
 * {@link Session#readBody(int, String, String)}.
 *
 * <p>The cause is the underlying transport failure. The body lines
 * received before the failure are available from {@link #getLines()}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BodyReadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final List<String> lines;

    /**
     * Creates a new body read exception.
     *
     * @param lines the lines read before the failure
     * @param cause the underlying cause
     */
    public BodyReadException(List<String> lines, IOException cause) {
        super(cause.getMessage(), cause);
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * Returns the body lines read before the failure, each with its
     * original terminator.
     *
     * @return the partial body
     */
    public List<String> getLines() {
        return lines;
    }

}
