/*
 * RequestLogFormatter.java
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

import java.time.Instant;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Formats request log entries as
 * {@code [seconds.nanoseconds] client - summary}.
 * The client is the first record parameter; the summary is the message,
 * used verbatim.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RequestLogFormatter extends Formatter {

    static final String EOL = System.getProperty("line.separator");

    @Override
    public String format(LogRecord record) {
        Object[] params = record.getParameters();
        Object client = (params != null && params.length > 0) ? params[0] : "unknown";
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(formatTimestamp(record.getInstant())).append("] ");
        buf.append(client);
        buf.append(" - ");
        buf.append(record.getMessage());
        buf.append(EOL);
        return buf.toString();
    }

    /**
     * Formats an instant as seconds since the epoch with nine fractional
     * digits.
     */
    public static String formatTimestamp(Instant instant) {
        return String.format("%d.%09d", instant.getEpochSecond(), instant.getNano());
    }

}
