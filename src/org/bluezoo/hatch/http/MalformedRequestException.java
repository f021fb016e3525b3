/*
 * MalformedRequestException.java
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
 * Thrown when a request line lacks a method or a path.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MalformedRequestException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String requestLine;

    public MalformedRequestException(String requestLine) {
        super("Malformed request line: " + requestLine);
        this.requestLine = requestLine;
    }

    /**
     * Returns the offending request line.
     */
    public String getRequestLine() {
        return requestLine;
    }

}
