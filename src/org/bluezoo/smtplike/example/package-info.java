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
 * Example application of the line protocol engine.
 *
 * <p>{@link org.bluezoo.smtplike.example.ExampleProtocol} defines a toy
 * protocol with a greeting, a few conversational commands and a command
 * that reads a multi-line body.
 * {@link org.bluezoo.smtplike.example.ExampleServer} serves it over TCP,
 * running one session per connection on a thread pool:
 * <pre>
 * java -Dsmtplike.port=1234 org.bluezoo.smtplike.example.ExampleServer
 * </pre>
 */
package org.bluezoo.smtplike.example;
