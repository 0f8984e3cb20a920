/*
 * ExampleServer.java
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

import java.io.EOFException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.smtplike.ProtocolTable;

/**
 * TCP server for the example protocol.
 *
 * <p>A dedicated thread accepts connections and hands each one to a pool
 * of session threads, where it runs against the shared
 * {@link ProtocolTable} with a fresh {@link ExampleSession}.
 *
 * <p>The following system properties configure the server when it is
 * started with {@link #main(String[])}:
 * <ul>
 *   <li>{@code smtplike.port} - the port to listen on (default 1234); a
 *       first command-line argument takes precedence</li>
 *   <li>{@code smtplike.address} - the address to bind to (default: all
 *       interfaces)</li>
 *   <li>{@code smtplike.backlog} - the listen backlog (default 50)</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExampleServer {

    private static final Logger LOGGER = Logger.getLogger(ExampleServer.class.getName());
    static final ResourceBundle L10N = ExampleProtocol.L10N;

    public static final int DEFAULT_PORT = 1234;
    public static final int DEFAULT_BACKLOG = 50;

    private final ProtocolTable<ExampleSession> table;

    private int port = DEFAULT_PORT;
    private InetAddress address;
    private int backlog = DEFAULT_BACKLOG;

    private ServerSocket serverSocket;
    private ExecutorService sessions;
    private AcceptThread acceptThread;
    private volatile boolean active;

    /**
     * Creates a server for the example protocol.
     */
    public ExampleServer() {
        this(ExampleProtocol.createTable());
    }

    /**
     * Creates a server for the given protocol table.
     *
     * @param table the protocol to run on each connection
     */
    public ExampleServer(ProtocolTable<ExampleSession> table) {
        this.table = table;
    }

    public int getPort() {
        return port;
    }

    /**
     * Sets the port to listen on. Port 0 selects an ephemeral port; use
     * {@link #getLocalPort()} after {@link #start()} to find it.
     *
     * @param port the port
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.port"), String.valueOf(port)));
        }
        this.port = port;
    }

    public InetAddress getAddress() {
        return address;
    }

    public void setAddress(InetAddress address) {
        this.address = address;
    }

    /**
     * Sets the address to bind to by name.
     *
     * @param address a host name or literal address, or null for all
     *        interfaces
     * @throws UnknownHostException if the name cannot be resolved
     */
    public void setAddress(String address) throws UnknownHostException {
        this.address = (address == null || address.isEmpty()) ? null : InetAddress.getByName(address);
    }

    public int getBacklog() {
        return backlog;
    }

    public void setBacklog(int backlog) {
        this.backlog = backlog;
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return the local port, or -1 if the server is not started
     */
    public synchronized int getLocalPort() {
        return (serverSocket != null) ? serverSocket.getLocalPort() : -1;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Binds the server socket and starts accepting connections.
     *
     * @throws IOException if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        if (active) {
            return;
        }
        ServerSocket socket = createServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(address, port), backlog);
        } catch (IOException e) {
            socket.close();
            String host = (address != null) ? address.getHostAddress() : "*";
            String msg = MessageFormat.format(L10N.getString("err.bind"), host, String.valueOf(port));
            throw new IOException(msg, e);
        }
        serverSocket = socket;
        sessions = Executors.newCachedThreadPool(new SessionThreadFactory());
        active = true;
        acceptThread = new AcceptThread(socket);
        acceptThread.start();
        if (LOGGER.isLoggable(Level.INFO)) {
            String msg = L10N.getString("info.listening");
            LOGGER.info(MessageFormat.format(msg, socket.getLocalSocketAddress()));
        }
    }

    ServerSocket createServerSocket() throws IOException {
        return new ServerSocket();
    }

    /**
     * Stops accepting connections. Sessions already running continue until
     * they end.
     */
    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        String description = String.valueOf(serverSocket.getLocalSocketAddress());
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, L10N.getString("log.close_failed"), e);
        }
        sessions.shutdown();
        if (LOGGER.isLoggable(Level.INFO)) {
            String msg = L10N.getString("info.stopped");
            LOGGER.info(MessageFormat.format(msg, description));
        }
    }

    /**
     * Waits for the accept thread to finish.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = acceptThread;
        }
        if (thread != null) {
            thread.join();
        }
    }

    /**
     * Passes an accepted connection to the session pool. A connection
     * accepted while the server was stopping is closed instead.
     *
     * @param client the accepted connection
     * @return false if the pool has been shut down
     */
    boolean handOff(Socket client) {
        ExecutorService pool;
        synchronized (this) {
            pool = sessions;
        }
        try {
            pool.execute(new SessionTask(client));
            return true;
        } catch (RejectedExecutionException e) {
            try {
                client.close();
            } catch (IOException ce) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = L10N.getString("log.close_rejected");
                    LOGGER.log(Level.FINE, MessageFormat.format(msg, client.getRemoteSocketAddress()), ce);
                }
            }
            return false;
        }
    }

    void runSession(Socket socket) {
        try {
            table.run(socket, new ExampleSession());
        } catch (EOFException e) {
            // Client went away without saying goodbye
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = L10N.getString("log.session_failed");
                LOGGER.log(Level.FINE, MessageFormat.format(msg, socket.getRemoteSocketAddress()), e);
            }
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String msg = L10N.getString("log.session_failed");
                LOGGER.log(Level.WARNING, MessageFormat.format(msg, socket.getRemoteSocketAddress()), e);
            }
        } catch (RuntimeException e) {
            // Faulty handler; the engine has already closed the connection
            if (LOGGER.isLoggable(Level.WARNING)) {
                String msg = L10N.getString("log.session_failed");
                LOGGER.log(Level.WARNING, MessageFormat.format(msg, socket.getRemoteSocketAddress()), e);
            }
        }
    }

    private class AcceptThread extends Thread {

        private final ServerSocket socket;

        AcceptThread(ServerSocket socket) {
            super("ExampleServer-Accept");
            this.socket = socket;
        }

        @Override
        public void run() {
            while (active) {
                final Socket client;
                try {
                    client = socket.accept();
                } catch (SocketException e) {
                    if (!active || socket.isClosed()) {
                        // Server socket closed by stop()
                        break;
                    }
                    LOGGER.log(Level.WARNING, L10N.getString("log.accept_failed"), e);
                    continue;
                } catch (IOException e) {
                    LOGGER.log(Level.WARNING, L10N.getString("log.accept_failed"), e);
                    continue;
                }
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = L10N.getString("info.connection");
                    LOGGER.fine(MessageFormat.format(msg, client.getRemoteSocketAddress()));
                }
                if (!handOff(client)) {
                    break;
                }
            }
        }

    }

    private class SessionTask implements Runnable {

        private final Socket socket;

        SessionTask(Socket socket) {
            this.socket = socket;
        }

        @Override
        public void run() {
            runSession(socket);
        }

    }

    private static class SessionThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ExampleServer-Session-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }

    }

    // -- Main entry point --

    public static void main(String[] args) {
        ExampleServer server = new ExampleServer();
        try {
            int port = Integer.getInteger("smtplike.port", DEFAULT_PORT);
            if (args.length > 0) {
                port = Integer.parseInt(args[0]);
            }
            server.setPort(port);
            server.setAddress(System.getProperty("smtplike.address"));
            server.setBacklog(Integer.getInteger("smtplike.backlog", DEFAULT_BACKLOG));
        } catch (NumberFormatException e) {
            System.err.println(MessageFormat.format(L10N.getString("err.port"), args[0]));
            System.exit(1);
            return;
        } catch (IllegalArgumentException | UnknownHostException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println(L10N.getString("banner"));
        try {
            server.start();
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e);
            System.exit(2);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownTask(server)));

        try {
            server.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class ShutdownTask implements Runnable {

        private final ExampleServer server;

        ShutdownTask(ExampleServer server) {
            this.server = server;
        }

        @Override
        public void run() {
            server.stop();
        }

    }

}
