/*
 * ExampleSession.java
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

package org.bluezoo.smtplike.example;

/**
 * Per-connection state of the example protocol.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExampleSession {

    private boolean greeted;
    private int messagesTold;

    /**
     * Indicates whether the client has introduced itself with HELO.
     *
     * @return true after a HELO command
     */
    public boolean isGreeted() {
        return greeted;
    }

    public void setGreeted(boolean greeted) {
        this.greeted = greeted;
    }

    public int getMessagesTold() {
        return messagesTold;
    }

    void messageTold() {
        messagesTold++;
    }

}
