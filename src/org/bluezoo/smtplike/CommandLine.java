/*
 * CommandLine.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A command line split into a command token and its arguments.
 *
 * <p>Fields are separated by runs of whitespace; leading and trailing
 * whitespace, including the line terminator, is ignored. The command token
 * is converted to lower case, the arguments are kept as received.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CommandLine {

    private final String command;
    private final List<String> arguments;

    private CommandLine(String command, List<String> arguments) {
        this.command = command;
        this.arguments = arguments;
    }

    /**
     * Splits a line into fields.
     *
     * @param line the line as received, with or without its terminator
     * @return the parsed command line, or null if the line contains no
     *         fields
     */
    public static CommandLine parse(String line) {
        List<String> fields = split(line);
        if (fields.isEmpty()) {
            return null;
        }
        String command = fields.get(0).toLowerCase(Locale.ROOT);
        List<String> arguments = Collections.unmodifiableList(fields.subList(1, fields.size()));
        return new CommandLine(command, arguments);
    }

    static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        int len = line.length();
        int start = -1;
        for (int i = 0; i < len; i++) {
            if (isSeparator(line.charAt(i))) {
                if (start >= 0) {
                    fields.add(line.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            fields.add(line.substring(start));
        }
        return fields;
    }

    static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * Returns the command token in lower case.
     *
     * @return the command token
     */
    public String getCommand() {
        return command;
    }

    /**
     * Returns the fields following the command token.
     *
     * @return an unmodifiable list of arguments, possibly empty
     */
    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return arguments.isEmpty() ? command : command + " " + String.join(" ", arguments);
    }

}
