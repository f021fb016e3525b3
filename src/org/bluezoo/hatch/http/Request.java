/*
 * Request.java
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

package org.bluezoo.hatch.http;

import java.nio.charset.StandardCharsets;

/**
 * The request line of a single HTTP request.
 *
 * <p>Only the method and request-target are extracted. The protocol
 * version and any headers are read along with the request line but are
 * not interpreted. Bytes that are not valid UTF-8 are replaced rather
 * than rejected.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Request {

    private final String method;
    private final String path;

    Request(String method, String path) {
        this.method = method;
        this.path = path;
    }

    /**
     * Parses the request head held in the first {@code length} bytes of
     * {@code buf}.
     *
     * @param buf the buffer the request head was read into
     * @param length the number of bytes read
     * @return the parsed request, or null if the buffer holds no request
     * line at all
     * @throws MalformedRequestException if the request line does not
     * carry both a method and a path
     */
    public static Request parse(byte[] buf, int length) throws MalformedRequestException {
        if (length <= 0) {
            return null;
        }
        String head = new String(buf, 0, length, StandardCharsets.UTF_8);
        int eol = head.indexOf('\n');
        String line = (eol >= 0) ? head.substring(0, eol) : head;
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }

        String method = null;
        String path = null;
        int len = line.length();
        int pos = 0;
        while (pos < len && path == null) {
            while (pos < len && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            int start = pos;
            while (pos < len && !Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            if (pos > start) {
                String token = line.substring(start, pos);
                if (method == null) {
                    method = token;
                } else {
                    path = token;
                }
            }
        }
        if (path == null) {
            throw new MalformedRequestException(line);
        }
        return new Request(method, path);
    }

    /**
     * Returns the request method, e.g. {@code GET}.
     */
    public String getMethod() {
        return method;
    }

    /**
     * Returns the request-target exactly as sent by the client.
     */
    public String getPath() {
        return path;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

}
