/*
 * CommandEntry.java
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

import java.util.Locale;

/**
 * A command token and the handler invoked for it.
 *
 * <p>The token is stored in lower case. The empty token denotes the
 * greeting entry, which may only appear first in a {@link ProtocolTable}.
 *
 * @param <C> the type of the per-connection application context
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CommandEntry<C> {

    private final String token;
    private final CommandHandler<C> handler;

    /**
     * Creates a command entry.
     *
     * @param token the command token, or the empty string for a greeting
     * @param handler the handler
     * @throws IllegalArgumentException if the token contains whitespace or
     *         either argument is null
     */
    public CommandEntry(String token, CommandHandler<C> handler) {
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null for " + token);
        }
        for (int i = 0; i < token.length(); i++) {
            if (CommandLine.isSeparator(token.charAt(i))) {
                throw new IllegalArgumentException("Command token contains whitespace: '" + token + "'");
            }
        }
        this.token = token.toLowerCase(Locale.ROOT);
        this.handler = handler;
    }

    public String getToken() {
        return token;
    }

    public CommandHandler<C> getHandler() {
        return handler;
    }

    /**
     * Indicates whether this is a greeting entry.
     *
     * @return true if the token is empty
     */
    public boolean isGreeting() {
        return token.isEmpty();
    }

    @Override
    public String toString() {
        return isGreeting() ? "(greeting)" : token;
    }

}
