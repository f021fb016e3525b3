/*
 * LaconicFormatter.java
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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * A console formatter that prints the minimum of information: the time,
 * the level and the message, followed by any stack trace.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append('[');
        buf.append(RequestLogFormatter.formatTimestamp(record.getInstant()));
        buf.append("] ");
        buf.append(record.getLevel().getLocalizedName());
        buf.append(": ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(System.getProperty("line.separator"));
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
