/*
 * package-info.java
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

/**
 * Server engine for SMTP-style line protocols.
 *
 * <p>In an SMTP-style protocol the client sends text commands terminated
 * by LF (usually CRLF) with arguments separated by whitespace, and the
 * server answers each command with CRLF-terminated lines consisting of a
 * three-digit code and a message. In the last line of a reply the code is
 * followed by a space; in all preceding lines by a hyphen. Some commands
 * may be followed by free-form text ending with a predefined line.
 *
 * <pre>
 * S: 220 Hello
 * C: TELL everyone
 * S: 354-What should I tell them?
 * S: 354 Tell me, terminate with "."
 * C: Nothing to say, it's just a meaningless
 * C: multiline message under 140 characters.
 * C: .
 * S: 250 Ok, I'll tell everyone.
 * C: quit
 * S: 221 Bye
 * </pre>
 *
 * <h2>Architecture</h2>
 * <ul>
 *   <li>{@link org.bluezoo.smtplike.ProtocolTable} - the commands of a
 *       protocol and the entry point that runs a session</li>
 *   <li>{@link org.bluezoo.smtplike.CommandHandler} - application logic
 *       for one command</li>
 *   <li>{@link org.bluezoo.smtplike.Session} - per-connection state seen
 *       by handlers, including the body reader</li>
 *   <li>{@link org.bluezoo.smtplike.Reply} and
 *       {@link org.bluezoo.smtplike.ReplyEncoder} - replies and their wire
 *       form</li>
 *   <li>{@link org.bluezoo.smtplike.Transport} - the byte stream a session
 *       runs over</li>
 * </ul>
 *
 * <p>The engine is blocking: each session runs on the thread that called
 * {@link org.bluezoo.smtplike.ProtocolTable#run(Transport, Object)} until
 * a handler ends it with code 221 or 421 or the connection fails. Accepting
 * connections and running sessions concurrently is left to the
 * application; see {@link org.bluezoo.smtplike.example.ExampleServer}.
 *
 * <h2>Logging</h2>
 * <p>Session lifecycle is logged at {@code FINE}, individual commands and
 * replies at {@code FINEST}, using {@link java.util.logging}.
 */
package org.bluezoo.smtplike;
