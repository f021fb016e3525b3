/*
 * Response.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complete HTTP/1.1 response: status line, headers and body.
 *
 * <p>The Content-Length header is derived from the body and cannot be set
 * directly, so it always matches the number of body bytes sent. A
 * {@code 204 No Content} response carries neither a body nor a
 * Content-Length.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Response {

    private static final byte[] CRLF = { '\r', '\n' };
    private static final byte[] EMPTY = new byte[0];

    private final HTTPStatus status;
    private final List<String[]> headers;
    private byte[] body;

    public Response(HTTPStatus status) {
        this.status = status;
        this.headers = new ArrayList<>();
        this.body = EMPTY;
    }

    /**
     * Adds a header. Headers are written in the order they were added.
     *
     * @param name the header name
     * @param value the header value
     * @return this response
     * @throws IllegalArgumentException if name is Content-Length or either
     * argument contains a line break
     */
    public Response addHeader(String name, String value) {
        if ("Content-Length".equalsIgnoreCase(name)) {
            throw new IllegalArgumentException("Content-Length is derived from the body");
        }
        if (containsLineBreak(name) || containsLineBreak(value)) {
            throw new IllegalArgumentException("Header contains line break: " + name);
        }
        headers.add(new String[] { name, value });
        return this;
    }

    /**
     * Sets the body and its Content-Type.
     *
     * @param contentType the media type of the body
     * @param body the body bytes
     * @return this response
     */
    public Response setBody(String contentType, byte[] body) {
        if (status == HTTPStatus.NO_CONTENT) {
            throw new IllegalStateException("204 responses have no body");
        }
        addHeader("Content-Type", contentType);
        this.body = (body != null) ? body : EMPTY;
        return this;
    }

    /**
     * Sets a textual body encoded as UTF-8.
     */
    public Response setBody(String contentType, String body) {
        return setBody(contentType, body.getBytes(StandardCharsets.UTF_8));
    }

    public HTTPStatus getStatus() {
        return status;
    }

    public byte[] getBody() {
        return body;
    }

    /**
     * Returns the value of the first header with the given name, matched
     * case-insensitively, or null. Content-Length is reported as written.
     */
    public String getHeader(String name) {
        if ("Content-Length".equalsIgnoreCase(name)) {
            return hasContentLength() ? Integer.toString(body.length) : null;
        }
        for (String[] header : headers) {
            if (header[0].equalsIgnoreCase(name)) {
                return header[1];
            }
        }
        return null;
    }

    /**
     * Returns the names of the headers that will be written, in order.
     */
    public List<String> getHeaderNames() {
        List<String> names = new ArrayList<>();
        if (hasContentLength()) {
            names.add("Content-Length");
        }
        for (String[] header : headers) {
            names.add(header[0]);
        }
        return Collections.unmodifiableList(names);
    }

    private boolean hasContentLength() {
        return status != HTTPStatus.NO_CONTENT;
    }

    /**
     * Writes this response to the given stream: one header block, the
     * blank line, then the body.
     *
     * @param out the connection output stream
     * @throws IOException if the write fails
     */
    public void writeTo(OutputStream out) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream(256);
        writeLine(head, "HTTP/1.1 " + status.code + " " + status.reasonPhrase);
        if (hasContentLength()) {
            writeLine(head, "Content-Length: " + body.length);
        }
        for (String[] header : headers) {
            writeLine(head, header[0] + ": " + header[1]);
        }
        head.write(CRLF);
        head.writeTo(out);
        if (body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    private static void writeLine(ByteArrayOutputStream sink, String line) throws IOException {
        sink.write(line.getBytes(StandardCharsets.ISO_8859_1));
        sink.write(CRLF);
    }

    private static boolean containsLineBreak(String s) {
        return s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0;
    }

    @Override
    public String toString() {
        return "HTTP/1.1 " + status + " (" + body.length + " bytes)";
    }

}
