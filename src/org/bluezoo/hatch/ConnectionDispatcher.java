/*
 * ConnectionDispatcher.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of hatch, a small static HTTP server.
 *
 * hatch is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * hatch is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with hatch.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.hatch;

import org.bluezoo.hatch.http.RequestHandler;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.text.MessageFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts connections and hands each one to its own handler thread.
 *
 * <p>At most {@code maxConcurrent} connections are handled at once. Each
 * handler holds one slot of a semaphore from just before it is dispatched
 * until its connection is closed. When every slot is taken the accept
 * loop waits for one to be released, and further clients queue in the
 * operating system's accept backlog.
 *
 * <p>Failures inside a handler are logged by that handler and affect no
 * other connection. Accept failures are logged and the loop carries on.
 * Only failing to bind the listening socket is reported to the caller.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ConnectionHandler
 */
public class ConnectionDispatcher {

    private static final Logger LOGGER = Logger.getLogger(ConnectionDispatcher.class.getName());

    /** Default maximum number of concurrently handled connections */
    public static final int DEFAULT_MAX_CONCURRENT = 4;

    /** Default size of the buffer the request head is read into */
    public static final int DEFAULT_BUFFER_SIZE = 4096;

    /** Default socket read timeout in milliseconds */
    public static final int DEFAULT_READ_TIMEOUT = 30000;

    private final RequestHandler requestHandler;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private int readTimeout = DEFAULT_READ_TIMEOUT;

    private volatile ServerSocket serverSocket;
    private volatile boolean active;
    private Semaphore slots;
    private int maxConcurrent;
    private ExecutorService workers;

    public ConnectionDispatcher(RequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Sets the size of the single read that must hold the request head.
     * Longer heads are truncated.
     */
    public void setBufferSize(int bufferSize) {
        if (bufferSize < 16) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.invalid_buffer_size"), bufferSize));
        }
        this.bufferSize = bufferSize;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    /**
     * Sets the socket read timeout in milliseconds, 0 for none.
     */
    public void setReadTimeout(int readTimeout) {
        if (readTimeout < 0) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.invalid_read_timeout"), readTimeout));
        }
        this.readTimeout = readTimeout;
    }

    /**
     * Binds to the given address and accepts connections until
     * {@link #close} is called.
     *
     * @param address the address to listen on
     * @param maxConcurrent the maximum number of connections handled at once
     * @throws IOException if the listening socket cannot be bound
     */
    public void run(InetSocketAddress address, int maxConcurrent) throws IOException {
        bind(address, maxConcurrent);
        serve();
    }

    /**
     * Binds the listening socket.
     *
     * @param address the address to listen on
     * @param maxConcurrent the maximum number of connections handled at once
     * @throws IOException if the listening socket cannot be bound
     */
    public synchronized void bind(InetSocketAddress address, int maxConcurrent) throws IOException {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.invalid_max_concurrent"), maxConcurrent));
        }
        if (serverSocket != null) {
            throw new IllegalStateException(Hatch.L10N.getString("err.already_bound"));
        }
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(address);
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
        this.maxConcurrent = maxConcurrent;
        this.slots = new Semaphore(maxConcurrent, true);
        this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("hatch-handler"));
        this.active = true;
        this.serverSocket = socket;

        LOGGER.info(MessageFormat.format(Hatch.L10N.getString("info.listening"),
            socket.getInetAddress().getHostAddress(), Integer.toString(socket.getLocalPort()),
            maxConcurrent));
    }

    /**
     * Runs the accept loop on the calling thread until {@link #close} is
     * called or the thread is interrupted.
     */
    public void serve() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException(Hatch.L10N.getString("err.not_bound"));
        }
        while (active) {
            Socket client;
            try {
                client = socket.accept();
            } catch (IOException e) {
                if (!active || socket.isClosed()) {
                    break;
                }
                LOGGER.log(Level.WARNING, Hatch.L10N.getString("err.accept"), e);
                continue;
            }

            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeQuietly(client);
                break;
            }

            try {
                workers.execute(new ConnectionHandler(client, requestHandler, slots,
                        bufferSize, readTimeout));
            } catch (RejectedExecutionException e) {
                slots.release();
                closeQuietly(client);
                if (active) {
                    LOGGER.log(Level.WARNING, Hatch.L10N.getString("err.dispatch"), e);
                }
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(Hatch.L10N.getString("info.accept_loop_end"));
        }
    }

    /**
     * Returns the local port of the listening socket, or -1 if not bound.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return (socket != null) ? socket.getLocalPort() : -1;
    }

    /**
     * Returns the number of connections currently being handled.
     */
    public int getActiveConnections() {
        Semaphore s = slots;
        return (s != null) ? maxConcurrent - s.availablePermits() : 0;
    }

    /**
     * Stops accepting connections. Connections already being handled run
     * to completion.
     */
    public synchronized void close() {
        active = false;
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        if (workers != null) {
            workers.shutdown();
        }
    }

    static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, Hatch.L10N.getString("err.close"), e);
            }
        }
    }

}
