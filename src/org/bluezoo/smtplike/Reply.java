/*
 * Reply.java
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

/**
 * A reply to be sent to the client: a numeric status code and a message.
 *
 * <p>The message may span several lines separated by {@code '\n'}. When
 * encoded, every line but the last is sent as a continuation line
 * ({@code 250-...}) and the last line as the final line ({@code 250 ...}).
 *
 * <p>Status codes are conventionally grouped as follows:
 * <pre>
 * 1xx Positive Preliminary
 * 2xx Positive Completion
 * 3xx Positive Intermediate
 * 4xx Transient Negative Completion
 * 5xx Permanent Negative Completion
 *
 * x0x Syntax
 * x1x Information
 * x2x Connection
 * x3x Authentication and accounting
 * x5x Mail system or file system status
 * </pre>
 * Only {@link #GOODBYE} and {@link #UNAVAILABLE} have a meaning to the
 * engine: a reply with either code ends the session once it has been sent.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ReplyEncoder
 */
public final class Reply {

    /**
     * Conventional greeting code. It has no special meaning to the engine.
     */
    public static final int HELLO = 220;

    /**
     * Closing code. The session terminates after this reply is sent.
     */
    public static final int GOODBYE = 221;

    /**
     * Service unavailable. The session terminates after this reply is sent.
     */
    public static final int UNAVAILABLE = 421;

    /**
     * Sent when a line does not contain a known command.
     */
    public static final int UNKNOWN_COMMAND = 500;

    /**
     * Default message accompanying {@link #UNKNOWN_COMMAND}.
     */
    public static final String UNKNOWN_COMMAND_MESSAGE = "Unknown command";

    static final int MAX_CODE = 999;

    private final int code;
    private final String message;

    /**
     * Creates a reply.
     *
     * @param code the status code, between 0 and 999
     * @param message the message, lines separated by {@code '\n'};
     *        null is treated as the empty message
     * @throws IllegalArgumentException if the code is out of range
     */
    public Reply(int code, String message) {
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException("Reply code out of range: " + code);
        }
        this.code = code;
        this.message = (message == null) ? "" : message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Indicates whether sending this reply ends the session.
     *
     * @return true if the code is {@link #GOODBYE} or {@link #UNAVAILABLE}
     */
    public boolean isTerminal() {
        return isTerminal(code);
    }

    static boolean isTerminal(int code) {
        return code == GOODBYE || code == UNAVAILABLE;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Reply)) {
            return false;
        }
        Reply o = (Reply) other;
        return code == o.code && message.equals(o.message);
    }

    @Override
    public int hashCode() {
        return code * 31 + message.hashCode();
    }

    @Override
    public String toString() {
        return code + " " + message;
    }

}
