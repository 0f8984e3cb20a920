/*
 * CommandHandler.java
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
import java.util.List;

/**
 * Handles one command of a line protocol.
 *
 * <p>A handler receives the arguments that followed the command token and
 * the session of the connection the command arrived on. It returns the
 * reply to send to the client. Returning a reply with code
 * {@link Reply#GOODBYE} or {@link Reply#UNAVAILABLE} ends the session.
 *
 * <p>A handler that needs free-form input following the command (a
 * message body, say) calls {@link Session#readBody(int, String, String)}
 * before returning. Failures of that call should be allowed to propagate;
 * the session remembers them in any case and the dispatch loop will end the
 * session with the failure whatever the handler returns.
 *
 * <p>Handlers are shared by every session using the same
 * {@link ProtocolTable} and may be called concurrently from different
 * sessions. Per-connection state belongs in the session context.
 *
 * @param <C> the type of the per-connection application context
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ProtocolTable
 */
public interface CommandHandler<C> {

    /**
     * Handles a command.
     *
     * @param arguments the whitespace-separated arguments following the
     *        command token; empty for the greeting handler
     * @param session the session the command was received on
     * @return the reply to send, never null
     * @throws IOException if communicating with the client fails
     */
    Reply handle(List<String> arguments, Session<C> session) throws IOException;

}
