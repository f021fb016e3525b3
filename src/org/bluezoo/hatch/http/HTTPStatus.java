/*
 * HTTPStatus.java
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

/**
 * The HTTP status codes this server can answer with.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum HTTPStatus {

    // ─────────────────────────────────────────────────────────────────────────
    // Success (2xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 200 OK */
    OK(200, "OK"),

    /** 204 No Content */
    NO_CONTENT(204, "No Content"),

    // ─────────────────────────────────────────────────────────────────────────
    // Client Errors (4xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 400 Bad Request */
    BAD_REQUEST(400, "Bad Request"),

    /** 404 Not Found */
    NOT_FOUND(404, "Not Found"),

    /** 405 Method Not Allowed */
    METHOD_NOT_ALLOWED(405, "Method Not Allowed"),

    /** 429 Too Many Requests */
    TOO_MANY_REQUESTS(429, "Too Many Requests"),

    // ─────────────────────────────────────────────────────────────────────────
    // Server Errors (5xx)
    // ─────────────────────────────────────────────────────────────────────────

    /** 500 Internal Server Error */
    INTERNAL_SERVER_ERROR(500, "Internal Server Error");

    /**
     * The numeric HTTP status code.
     */
    public final int code;

    /**
     * The reason phrase sent on the status line.
     */
    public final String reasonPhrase;

    HTTPStatus(int code, String reasonPhrase) {
        this.code = code;
        this.reasonPhrase = reasonPhrase;
    }

    @Override
    public String toString() {
        return code + " " + reasonPhrase;
    }
}
