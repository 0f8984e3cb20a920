/*
 * ProtocolTable.java
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
import java.net.Socket;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The commands of a line protocol and the handlers that implement them.
 *
 * <p>A table is an ordered list of {@link CommandEntry} values. When a
 * line is received its first whitespace-separated field is converted to
 * lower case and matched against the entry tokens; the first matching
 * entry in registration order handles the line. Registering the same token
 * twice is allowed but the later entry is unreachable (a warning is logged
 * when the table is built). A line that matches nothing, or contains no
 * fields at all, is answered with {@code 500 Unknown command}.
 *
 * <p>The first entry may have the empty token. Its handler is called
 * with no arguments as soon as a session starts, to greet the client, and
 * is never matched against input.
 *
 * <p>A table is immutable and may be shared by any number of concurrently
 * running sessions:
 * <pre>
 * ProtocolTable&lt;State&gt; table = ProtocolTable.&lt;State&gt;builder()
 *         .greeting((args, session) -&gt; new Reply(Reply.HELLO, "ready"))
 *         .command("noop", (args, session) -&gt; new Reply(250, "Ok"))
 *         .command("quit", (args, session) -&gt; new Reply(Reply.GOODBYE, "bye"))
 *         .build();
 *
 * // for each accepted connection, on its own thread:
 * table.run(socket, new State());
 * </pre>
 *
 * @param <C> the type of the per-connection application context
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Session
 */
public final class ProtocolTable<C> {

    private static final Logger LOGGER = Logger.getLogger(ProtocolTable.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.smtplike.L10N");

    private final List<CommandEntry<C>> entries;
    private final CommandEntry<C> greeting;
    private final Map<String, CommandEntry<C>> index;
    private final Charset charset;
    private final Reply unknownCommandReply;

    /**
     * Creates a table using UTF-8 and the default unknown-command message.
     *
     * @param entries the entries in matching order
     * @throws IllegalArgumentException if an entry is null or a greeting
     *         entry appears anywhere but first
     */
    public ProtocolTable(List<CommandEntry<C>> entries) {
        this(entries, StandardCharsets.UTF_8, Reply.UNKNOWN_COMMAND_MESSAGE);
    }

    /**
     * Creates a table.
     *
     * @param entries the entries in matching order
     * @param charset the charset used for commands and replies
     * @param unknownCommandMessage the message sent with code 500 for
     *        lines that match no entry
     * @throws IllegalArgumentException if an entry is null, a greeting
     *         entry appears anywhere but first, or the charset does not
     *         encode US-ASCII characters as the same single bytes
     */
    public ProtocolTable(List<CommandEntry<C>> entries, Charset charset, String unknownCommandMessage) {
        if (charset == null) {
            throw new IllegalArgumentException("charset must not be null");
        }
        if (!isAsciiCompatible(charset)) {
            String msg = MessageFormat.format(L10N.getString("err.charset"), charset.name());
            throw new IllegalArgumentException(msg);
        }
        List<CommandEntry<C>> copy = new ArrayList<>(entries);
        Map<String, CommandEntry<C>> map = new HashMap<>();
        CommandEntry<C> greetingEntry = null;
        for (int i = 0; i < copy.size(); i++) {
            CommandEntry<C> entry = copy.get(i);
            if (entry == null) {
                throw new IllegalArgumentException("Null entry at position " + i);
            }
            if (entry.isGreeting()) {
                if (i != 0) {
                    String msg = MessageFormat.format(L10N.getString("err.greeting_position"), i);
                    throw new IllegalArgumentException(msg);
                }
                greetingEntry = entry;
                continue;
            }
            CommandEntry<C> existing = map.putIfAbsent(entry.getToken(), entry);
            if (existing != null && LOGGER.isLoggable(Level.WARNING)) {
                String msg = L10N.getString("log.duplicate_command");
                msg = MessageFormat.format(msg, entry.getToken(), i);
                LOGGER.warning(msg);
            }
        }
        this.entries = Collections.unmodifiableList(copy);
        this.greeting = greetingEntry;
        this.index = map;
        this.charset = charset;
        this.unknownCommandReply = new Reply(Reply.UNKNOWN_COMMAND, unknownCommandMessage);
    }

    /**
     * Lines are split on the LF byte before decoding, so the charset must
     * encode US-ASCII as single identical bytes.
     */
    static boolean isAsciiCompatible(Charset charset) {
        if (!charset.canEncode()) {
            return false;
        }
        byte[] ascii = new byte[128];
        for (int i = 0; i < ascii.length; i++) {
            ascii[i] = (byte) i;
        }
        String text = new String(ascii, StandardCharsets.US_ASCII);
        return Arrays.equals(ascii, text.getBytes(charset))
                && text.equals(new String(ascii, charset));
    }

    /**
     * Returns a builder for a new table.
     *
     * @param <C> the type of the per-connection application context
     * @return a new builder
     */
    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Returns all entries, including the greeting entry and any
     * unreachable duplicates, in registration order.
     *
     * @return an unmodifiable list of entries
     */
    public List<CommandEntry<C>> getEntries() {
        return entries;
    }

    /**
     * Returns the greeting entry.
     *
     * @return the greeting entry, or null if the table has none
     */
    public CommandEntry<C> getGreeting() {
        return greeting;
    }

    /**
     * Finds the entry handling a command.
     *
     * @param command the command token, in any case
     * @return the first entry registered for the token, or null
     */
    public CommandEntry<C> lookup(String command) {
        if (command == null || command.isEmpty()) {
            return null;
        }
        return index.get(command.toLowerCase(Locale.ROOT));
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Returns the reply sent for lines that match no entry.
     *
     * @return the unknown-command reply
     */
    public Reply getUnknownCommandReply() {
        return unknownCommandReply;
    }

    /**
     * Runs a session for this protocol on a transport.
     *
     * <p>If the table has a greeting entry its reply is sent first. Then
     * lines are read and dispatched one at a time until a handler returns
     * {@link Reply#GOODBYE} or {@link Reply#UNAVAILABLE}, or an I/O error
     * occurs. The transport is closed before this method returns or throws.
     *
     * <p>This method blocks for the lifetime of the connection. Running
     * several sessions concurrently is up to the caller.
     *
     * @param transport the connection to the client
     * @param context the application context for this connection, made
     *        available to handlers by {@link Session#getContext()}
     * @throws IOException if reading from or writing to the transport fails,
     *         including the client closing the connection
     *         ({@link java.io.EOFException}), or if a handler fails to read a
     *         body
     */
    public void run(Transport transport, C context) throws IOException {
        new Dispatcher<>(this, transport, context).run();
    }

    /**
     * Runs a session for this protocol on a connected socket.
     *
     * @param socket the connection to the client
     * @param context the application context for this connection
     * @throws IOException if reading from or writing to the socket fails
     * @see #run(Transport, Object)
     */
    public void run(Socket socket, C context) throws IOException {
        run(new SocketTransport(socket), context);
    }

    /**
     * Collects entries for a {@link ProtocolTable}.
     *
     * @param <C> the type of the per-connection application context
     */
    public static final class Builder<C> {

        private final List<CommandEntry<C>> entries = new ArrayList<>();
        private Charset charset = StandardCharsets.UTF_8;
        private String unknownCommandMessage = Reply.UNKNOWN_COMMAND_MESSAGE;

        Builder() {
        }

        /**
         * Sets the greeting handler. This must be called before any command
         * is added, and at most once.
         *
         * @param handler the handler called when a session starts
         * @return this builder
         * @throws IllegalStateException if commands or a greeting have
         *         already been added
         */
        public Builder<C> greeting(CommandHandler<C> handler) {
            if (!entries.isEmpty()) {
                throw new IllegalStateException(L10N.getString("err.greeting_order"));
            }
            entries.add(new CommandEntry<>("", handler));
            return this;
        }

        /**
         * Adds a command.
         *
         * @param token the command token, matched case-insensitively
         * @param handler the handler for the command
         * @return this builder
         * @throws IllegalArgumentException if the token is null, empty or
         *         contains whitespace, or the handler is null
         */
        public Builder<C> command(String token, CommandHandler<C> handler) {
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException(L10N.getString("err.empty_token"));
            }
            entries.add(new CommandEntry<>(token, handler));
            return this;
        }

        /**
         * Sets the charset used to decode commands and encode replies.
         * The default is UTF-8. It must be a superset of US-ASCII, such as
         * ISO-8859-1; {@link #build()} rejects charsets like UTF-16.
         *
         * @param charset the charset
         * @return this builder
         */
        public Builder<C> charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        /**
         * Sets the message sent with code 500 for unknown commands.
         * The default is {@value Reply#UNKNOWN_COMMAND_MESSAGE}.
         *
         * @param message the message
         * @return this builder
         */
        public Builder<C> unknownCommandMessage(String message) {
            this.unknownCommandMessage = message;
            return this;
        }

        /**
         * Creates the table.
         *
         * @return a new immutable table
         */
        public ProtocolTable<C> build() {
            return new ProtocolTable<>(entries, charset, unknownCommandMessage);
        }

    }

}
