/*
 * Dispatcher.java
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
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one session against a protocol table.
 *
 * <p>The session moves through the following states:
 * <pre>
 * Init -&gt; [Greet] -&gt; AwaitLine -&gt; Dispatch -&gt; Respond -&gt; AwaitLine | Terminated
 * </pre>
 * It terminates only when a reply with a terminal code has been sent or
 * when an I/O operation fails. The transport is closed exactly once, on
 * every path out of {@link #run()}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class Dispatcher<C> {

    private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.smtplike.L10N");

    private final ProtocolTable<C> table;
    private final Transport transport;
    private final C context;

    Dispatcher(ProtocolTable<C> table, Transport transport, C context) {
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        this.table = table;
        this.transport = transport;
        this.context = context;
    }

    void run() throws IOException {
        try {
            Session<C> session = new Session<>(transport, context, table.getCharset());
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = L10N.getString("log.session_started");
                LOGGER.fine(MessageFormat.format(msg, session));
            }
            dispatch(session);
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = L10N.getString("log.session_failed");
                msg = MessageFormat.format(msg, describeTransport(), e.toString());
                LOGGER.fine(msg);
            }
            throw e;
        } finally {
            closeTransport();
        }
    }

    private void dispatch(Session<C> session) throws IOException {
        CommandEntry<C> greeting = table.getGreeting();
        if (greeting != null) {
            Reply reply = invoke(greeting, Collections.<String>emptyList(), session);
            session.respond(reply);
            if (reply.isTerminal()) {
                ended(session, reply);
                return;
            }
        }
        while (true) {
            String line = session.readLine();
            CommandLine commandLine = CommandLine.parse(line);
            CommandEntry<C> entry = null;
            if (commandLine != null) {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    String msg = L10N.getString("log.command_received");
                    LOGGER.finest(MessageFormat.format(msg, session, commandLine));
                }
                entry = table.lookup(commandLine.getCommand());
            }
            Reply reply;
            if (entry == null) {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    String msg = L10N.getString("log.unknown_command");
                    LOGGER.finest(MessageFormat.format(msg, session, Session.chop(line)));
                }
                reply = table.getUnknownCommandReply();
            } else {
                reply = invoke(entry, commandLine.getArguments(), session);
            }
            session.respond(reply);
            if (reply.isTerminal()) {
                ended(session, reply);
                return;
            }
        }
    }

    /**
     * Calls a handler. A failure recorded on the session while the handler
     * ran takes precedence over whatever the handler returned or threw.
     */
    private Reply invoke(CommandEntry<C> entry, List<String> arguments, Session<C> session)
            throws IOException {
        Reply reply;
        session.setHandling(true);
        try {
            reply = entry.getHandler().handle(arguments, session);
        } catch (IOException e) {
            throw recordedError(session, e);
        } catch (RuntimeException e) {
            IOException error = session.getError();
            if (error != null) {
                error.addSuppressed(e);
                throw error;
            }
            throw e;
        } finally {
            session.setHandling(false);
        }
        IOException error = session.getError();
        if (error != null) {
            throw error;
        }
        if (reply == null) {
            String msg = MessageFormat.format(L10N.getString("err.null_reply"), entry);
            throw new IllegalStateException(msg);
        }
        return reply;
    }

    private static IOException recordedError(Session<?> session, IOException thrown) {
        IOException error = session.getError();
        if (error == null) {
            return thrown;
        }
        if (thrown != error && thrown.getCause() != error) {
            error.addSuppressed(thrown);
        }
        return error;
    }

    private void ended(Session<C> session, Reply reply) {
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = L10N.getString("log.session_ended");
            msg = MessageFormat.format(msg, session, String.valueOf(reply.getCode()));
            LOGGER.fine(msg);
        }
    }

    private void closeTransport() {
        try {
            transport.close();
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = L10N.getString("log.error_closing");
                LOGGER.log(Level.FINE, MessageFormat.format(msg, describeTransport()), e);
            }
        }
    }

    private String describeTransport() {
        Object remote = transport.getRemoteAddress();
        return (remote != null) ? remote.toString() : transport.toString();
    }

}
