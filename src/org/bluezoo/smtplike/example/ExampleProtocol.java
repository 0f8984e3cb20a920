/*
 * ExampleProtocol.java
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

import java.io.IOException;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;

import org.bluezoo.smtplike.CommandHandler;
import org.bluezoo.smtplike.ProtocolTable;
import org.bluezoo.smtplike.Reply;
import org.bluezoo.smtplike.Session;

/**
 * A small demonstration protocol.
 *
 * <p>"help" is a good command to start with. The protocol resembles SMTP
 * only superficially: MAIL, RCPT and DATA are answered with 421 and the
 * connection is closed.
 * <pre>
 * S: 220 may i help you?
 * C: helo
 * S: 250 oh, hi!
 * C: how is everyone
 * S: 201 everyone is ok
 * C: tell everyone
 * S: 354-What should I tell them?
 * S: 354 Tell me, terminate with "."
 * C: Hello.
 * C: .
 * S: 250 Ok, I'll tell everyone (1 line).
 * C: quit
 * S: 221 bye
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExampleProtocol {

    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.smtplike.example.L10N");

    static final int HELP = 214;
    static final int OK = 250;
    static final int FINE = 200;
    static final int STATUS = 201;
    static final int START_INPUT = 354;
    static final int SYNTAX_ERROR = 501;
    static final int BAD_SEQUENCE = 503;

    private ExampleProtocol() {
    }

    /**
     * Creates the command table of the example protocol.
     *
     * @return a new table
     */
    public static ProtocolTable<ExampleSession> createTable() {
        CommandHandler<ExampleSession> unavailable = new Unavailable();
        return ProtocolTable.<ExampleSession>builder()
                .greeting(new Greet())
                .command("help", new Help())
                .command("helo", new Helo())
                .command("how", new How())
                .command("tell", new Tell())
                .command("quit", new Quit())
                .command("mail", unavailable)
                .command("rcpt", unavailable)
                .command("data", unavailable)
                .build();
    }

    static class Greet implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            return new Reply(Reply.HELLO, L10N.getString("greeting"));
        }

    }

    static class Help implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            return new Reply(HELP, L10N.getString("help"));
        }

    }

    static class Helo implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            session.getContext().setGreeted(true);
            return new Reply(OK, L10N.getString("helo"));
        }

    }

    static class How implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            if (!session.getContext().isGreeted()) {
                return new Reply(BAD_SEQUENCE, L10N.getString("err.helo_first"));
            }
            if (arguments.size() == 2) {
                String verb = arguments.get(0);
                String subject = arguments.get(1);
                if ("are".equals(verb) && "you".equals(subject)) {
                    return new Reply(FINE, L10N.getString("how.fine"));
                }
                if ("is".equals(verb)) {
                    String msg = MessageFormat.format(L10N.getString("how.is"), subject);
                    return new Reply(STATUS, msg);
                }
            }
            return new Reply(SYNTAX_ERROR, L10N.getString("how.usage"));
        }

    }

    /**
     * Reads a message terminated by a line containing a single dot.
     */
    static class Tell implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session)
                throws IOException {
            ExampleSession context = session.getContext();
            if (!context.isGreeted()) {
                return new Reply(BAD_SEQUENCE, L10N.getString("err.helo_first"));
            }
            if (arguments.isEmpty()) {
                return new Reply(SYNTAX_ERROR, L10N.getString("tell.usage"));
            }
            String who = String.join(" ", arguments);
            List<String> lines = session.readBody(START_INPUT, L10N.getString("tell.prompt"), ".");
            context.messageTold();
            String msg = MessageFormat.format(L10N.getString("tell.ok"), who, lines.size());
            return new Reply(OK, msg);
        }

    }

    static class Quit implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            return new Reply(Reply.GOODBYE, L10N.getString("quit"));
        }

    }

    static class Unavailable implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            return new Reply(Reply.UNAVAILABLE, L10N.getString("err.esmtp"));
        }

    }

}
