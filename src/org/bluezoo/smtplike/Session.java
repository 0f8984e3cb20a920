/*
 * Session.java
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
import java.net.SocketAddress;
import java.nio.charset.Charset;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The state of one connection running a line protocol.
 *
 * <p>A session is created by {@link ProtocolTable#run(Transport, Object)}
 * and passed to every {@link CommandHandler} invoked for the connection.
 * Handlers use it to reach the application context supplied when the
 * connection was accepted, and to read free-form input following a command
 * with {@link #readBody(int, String, String)}.
 *
 * <p>A session records the first I/O failure that occurs while a handler
 * is reading a body. Once recorded the failure is never cleared: the
 * dispatch loop ends the session with it as soon as the handler returns,
 * whatever reply the handler produced.
 *
 * <p>Sessions are not thread-safe. A session must only be used by the
 * thread running its dispatch loop, from within a handler invocation.
 *
 * @param <C> the type of the per-connection application context
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Session<C> {

    private static final Logger LOGGER = Logger.getLogger(Session.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.smtplike.L10N");

    private final Transport transport;
    private final LineReader in;
    private final OutputStream out;
    private final C context;
    private final Charset charset;

    private IOException error;
    private boolean handling;

    Session(Transport transport, C context, Charset charset) throws IOException {
        this.transport = transport;
        this.in = new LineReader(transport.getInputStream(), charset);
        this.out = transport.getOutputStream();
        this.context = context;
        this.charset = charset;
    }

    /**
     * Returns the application context supplied when the session started.
     *
     * @return the context, which may be null
     */
    public C getContext() {
        return context;
    }

    public SocketAddress getLocalAddress() {
        return transport.getLocalAddress();
    }

    public SocketAddress getRemoteAddress() {
        return transport.getRemoteAddress();
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Asks the client for multi-line input and reads it.
     *
     * <p>The reply given by {@code code} and {@code message} is sent first
     * (typically something like {@code 354 End data with <CR><LF>.<CR><LF>}).
     * Lines are then read until one equals {@code terminator} once a
     * single trailing LF and then a single trailing CR have been removed
     * from it. The terminator line is consumed but not returned. All other
     * lines are returned exactly as received, terminators included.
     *
     * <p>Lines read here are not seen by the dispatch loop: the handler
     * takes over the input until the terminator arrives.
     *
     * <p>If sending the prompt or reading fails, the failure is recorded
     * on the session and the session will end with it when the handler
     * returns. Handlers should normally let the exception propagate.
     *
     * <p>Example:
     * <pre>
     * public Reply handle(List&lt;String&gt; arguments, Session&lt;Mail&gt; session)
     *         throws IOException {
     *     List&lt;String&gt; lines = session.readBody(354,
     *             "Start mail input; end with &lt;CRLF&gt;.&lt;CRLF&gt;", ".");
     *     session.getContext().setBody(lines);
     *     return new Reply(250, "Ok");
     * }
     * </pre>
     *
     * @param code the status code of the prompt
     * @param message the prompt message
     * @param terminator the line that ends the body, without terminator
     * @return the body lines, each with its original terminator
     * @throws BodyReadException if reading fails; the exception carries
     *         the lines received before the failure
     * @throws IOException if sending the prompt fails
     * @throws IllegalStateException if not called from a command handler
     *         running on this session
     */
    public List<String> readBody(int code, String message, String terminator) throws IOException {
        if (terminator == null) {
            throw new IllegalArgumentException("terminator must not be null");
        }
        if (!handling) {
            throw new IllegalStateException(L10N.getString("err.not_handling"));
        }
        if (error != null) {
            throw error;
        }
        try {
            respond(new Reply(code, message));
        } catch (IOException e) {
            error = e;
            throw e;
        }
        List<String> lines = new ArrayList<>();
        while (true) {
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                error = e;
                throw new BodyReadException(lines, e);
            }
            if (chop(line).equals(terminator)) {
                break;
            }
            lines.add(line);
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = L10N.getString("log.body_received");
            msg = MessageFormat.format(msg, lines.size(), this);
            LOGGER.finest(msg);
        }
        return lines;
    }

    static String chop(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    String readLine() throws IOException {
        return in.readLine();
    }

    void respond(Reply reply) throws IOException {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = L10N.getString("log.reply_sent");
            msg = MessageFormat.format(msg, String.valueOf(reply.getCode()), this);
            LOGGER.finest(msg);
        }
        ReplyEncoder.send(out, reply, charset);
    }

    /**
     * Returns the failure recorded while reading a body, if any.
     */
    IOException getError() {
        return error;
    }

    void setHandling(boolean handling) {
        this.handling = handling;
    }

    @Override
    public String toString() {
        SocketAddress remote = transport.getRemoteAddress();
        return (remote != null) ? remote.toString() : transport.toString();
    }

}
