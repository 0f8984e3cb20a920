/*
 * ExampleServerTest.java
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.bluezoo.smtplike.CommandHandler;
import org.bluezoo.smtplike.ProtocolTable;
import org.bluezoo.smtplike.Reply;
import org.bluezoo.smtplike.Session;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Tests the example server over loopback TCP connections.
 */
public class ExampleServerTest {

    private static final int TIMEOUT = 5000;

    private ExampleServer server;

    @Before
    public void setUp() throws IOException {
        server = new ExampleServer();
        server.setAddress(InetAddress.getLoopbackAddress());
        server.setPort(0);
        server.start();
    }

    @After
    public void tearDown() {
        server.stop();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
        socket.setSoTimeout(TIMEOUT);
        return socket;
    }

    private static void send(OutputStream out, String line) throws IOException {
        out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    public void testConversation() throws IOException {
        try (Socket socket = connect()) {
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            OutputStream out = socket.getOutputStream();

            assertEquals("220 may i help you?", in.readLine());
            send(out, "HELO");
            assertEquals("250 oh, hi!", in.readLine());
            send(out, "how is everyone");
            assertEquals("201 everyone is ok", in.readLine());
            send(out, "tell everyone");
            assertEquals("354-What should I tell them?", in.readLine());
            assertEquals("354 Tell me, terminate with \".\"", in.readLine());
            send(out, "hello");
            send(out, ".");
            assertEquals("250 Ok, I'll tell everyone (1 line).", in.readLine());
            send(out, "quit");
            assertEquals("221 bye", in.readLine());
            // the server closes the connection after 221
            assertNull(in.readLine());
        }
    }

    @Test
    public void testConcurrentConnections() throws IOException {
        try (Socket first = connect(); Socket second = connect()) {
            BufferedReader in1 = new BufferedReader(
                    new InputStreamReader(first.getInputStream(), StandardCharsets.UTF_8));
            BufferedReader in2 = new BufferedReader(
                    new InputStreamReader(second.getInputStream(), StandardCharsets.UTF_8));
            assertEquals("220 may i help you?", in1.readLine());
            assertEquals("220 may i help you?", in2.readLine());

            // state is per connection
            send(first.getOutputStream(), "helo");
            assertEquals("250 oh, hi!", in1.readLine());
            send(second.getOutputStream(), "how are you");
            assertEquals("503 say helo first", in2.readLine());
            send(first.getOutputStream(), "how are you");
            assertEquals("200 fine, thanks", in1.readLine());

            send(second.getOutputStream(), "data");
            assertEquals("421 what is it, ESMTP?  service unavailable!", in2.readLine());
            assertNull(in2.readLine());
            send(first.getOutputStream(), "quit");
            assertEquals("221 bye", in1.readLine());
        }
    }

    @Test
    public void testStopRefusesNewConnections() throws Exception {
        int port = server.getLocalPort();
        assertTrue(server.isActive());
        server.stop();
        assertFalse(server.isActive());
        server.join();
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port)) {
            fail("Expected connection to be refused");
        } catch (IOException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPort() {
        server.setPort(70000);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Robustness

    /** Server socket whose first accepts fail as if descriptors ran out. */
    static class FlakyServerSocket extends ServerSocket {

        private int failures;

        FlakyServerSocket(int failures) throws IOException {
            this.failures = failures;
        }

        @Override
        public Socket accept() throws IOException {
            synchronized (this) {
                if (failures > 0) {
                    failures--;
                    throw new SocketException("Too many open files");
                }
            }
            return super.accept();
        }

    }

    static class BrokenGreeting implements CommandHandler<ExampleSession> {

        @Override
        public Reply handle(List<String> arguments, Session<ExampleSession> session) {
            throw new IllegalStateException("broken greeting");
        }

    }

    @Test
    public void testTransientAcceptFailureKeepsAccepting() throws IOException {
        ExampleServer flaky = new ExampleServer() {
            @Override
            ServerSocket createServerSocket() throws IOException {
                return new FlakyServerSocket(3);
            }
        };
        flaky.setAddress(InetAddress.getLoopbackAddress());
        flaky.setPort(0);
        flaky.start();
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), flaky.getLocalPort())) {
            socket.setSoTimeout(TIMEOUT);
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            assertEquals("220 may i help you?", in.readLine());
            send(socket.getOutputStream(), "quit");
            assertEquals("221 bye", in.readLine());
            assertTrue(flaky.isActive());
        } finally {
            flaky.stop();
        }
    }

    @Test
    public void testConnectionAcceptedDuringStopIsClosed() throws IOException {
        server.stop();
        Socket client = new Socket();
        assertFalse(server.handOff(client));
        assertTrue(client.isClosed());
    }

    @Test
    public void testHandlerRuntimeExceptionIsLogged() throws Exception {
        final CountDownLatch logged = new CountDownLatch(1);
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel() == Level.WARNING
                        && record.getThrown() instanceof IllegalStateException) {
                    logged.countDown();
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(ExampleServer.class.getName());
        logger.addHandler(handler);
        ProtocolTable<ExampleSession> table = ProtocolTable.<ExampleSession>builder()
                .greeting(new BrokenGreeting())
                .build();
        ExampleServer broken = new ExampleServer(table);
        broken.setAddress(InetAddress.getLoopbackAddress());
        broken.setPort(0);
        broken.start();
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), broken.getLocalPort())) {
            socket.setSoTimeout(TIMEOUT);
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            // the engine closes the connection before the exception escapes
            assertNull(in.readLine());
            assertTrue(logged.await(TIMEOUT, TimeUnit.MILLISECONDS));
        } finally {
            logger.removeHandler(handler);
            broken.stop();
        }
    }

}
