/*
 * ConnectionHandler.java
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
import org.bluezoo.hatch.http.Response;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.text.MessageFormat;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles a single connection: one read, one response, then close.
 *
 * <p>The request head must arrive in the first read. If the client sends
 * nothing before closing, no response is written. Whatever happens, the
 * socket is closed and the dispatcher slot released when the handler
 * finishes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class ConnectionHandler implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());

    static final String UNKNOWN_CLIENT = "unknown";

    private final Socket socket;
    private final RequestHandler requestHandler;
    private final Semaphore slots;
    private final int bufferSize;
    private final int readTimeout;

    ConnectionHandler(Socket socket, RequestHandler requestHandler, Semaphore slots,
            int bufferSize, int readTimeout) {
        this.socket = socket;
        this.requestHandler = requestHandler;
        this.slots = slots;
        this.bufferSize = bufferSize;
        this.readTimeout = readTimeout;
    }

    @Override
    public void run() {
        try {
            handle();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, MessageFormat.format(Hatch.L10N.getString("err.handling_client"),
                clientIdentity(socket)), e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, MessageFormat.format(Hatch.L10N.getString("err.handler_failed"),
                clientIdentity(socket)), e);
        } finally {
            ConnectionDispatcher.closeQuietly(socket);
            slots.release();
        }
    }

    private void handle() throws IOException {
        if (readTimeout > 0) {
            socket.setSoTimeout(readTimeout);
        }
        InputStream in = socket.getInputStream();
        byte[] buf = new byte[bufferSize];
        int len = in.read(buf);
        if (len <= 0) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(Hatch.L10N.getString("info.empty_request"),
                    clientIdentity(socket)));
            }
            return;
        }

        Response response = requestHandler.service(buf, len, clientIdentity(socket));
        if (response != null) {
            OutputStream out = socket.getOutputStream();
            response.writeTo(out);
            socket.shutdownOutput();
        }
    }

    /**
     * Returns the string form of the peer IP address.
     */
    static String clientIdentity(Socket socket) {
        InetAddress address = socket.getInetAddress();
        return (address != null) ? address.getHostAddress() : UNKNOWN_CLIENT;
    }

}
