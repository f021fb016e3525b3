/*
 * RequestLog.java
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

package org.bluezoo.hatch.log;

/**
 * Append-only log of completed requests.
 *
 * <p>Implementations are best effort: a failure to record an entry is
 * reported on the operational log and never reaches the client.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface RequestLog {

    /**
     * A request log that discards every entry.
     */
    RequestLog NONE = new RequestLog() {
        @Override
        public void logRequest(String client, String summary) {
        }
        @Override
        public void close() {
        }
    };

    /**
     * Records a request.
     *
     * @param client the client identity
     * @param summary a one-line summary, e.g. {@code GET /index.html 200}
     */
    void logRequest(String client, String summary);

    /**
     * Releases any resources held by this log.
     */
    void close();

}
