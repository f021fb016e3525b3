/*
 * package-info.java
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

/**
 * A small static HTTP server.
 *
 * <p>hatch serves files from a document root, answers exactly one request
 * per connection, limits how many requests each client may make per
 * minute, and keeps a visitor counter.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.hatch.Hatch} - entry point, wires the server
 *       together from a {@link org.bluezoo.hatch.HatchConfiguration}</li>
 *   <li>{@link org.bluezoo.hatch.ConnectionDispatcher} - accept loop with
 *       a fixed number of handler slots</li>
 *   <li>{@link org.bluezoo.hatch.http.RequestHandler} - turns a request
 *       into a response</li>
 * </ul>
 *
 * <h2>Running</h2>
 *
 * <pre>
 * java -Dhatch.port=8000 -Dhatch.maxConcurrent=4 org.bluezoo.hatch.Hatch
 * </pre>
 *
 * <p>See {@link org.bluezoo.hatch.HatchConfiguration} for every setting.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hatch;
