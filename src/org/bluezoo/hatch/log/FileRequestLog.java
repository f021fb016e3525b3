/*
 * FileRequestLog.java
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

import java.io.IOException;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request log appending to a file.
 *
 * <p>Entries go through a private, anonymous {@link Logger} whose only
 * handler is a {@link FileHandler} opened in append mode. Errors while
 * writing are reported by the handler's error manager. If the file cannot
 * be opened at all, the failure is logged once and entries are dropped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see RequestLogFormatter
 */
public class FileRequestLog implements RequestLog {

    private static final Logger LOGGER = Logger.getLogger(FileRequestLog.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.log.L10N");

    /** Default request log file */
    public static final String DEFAULT_PATH = "server.log";

    private final String path;
    private volatile Logger accessLogger;
    private FileHandler handler;

    public FileRequestLog(String path) {
        this.path = path;
        try {
            handler = new FileHandler(path, true);
            handler.setFormatter(new RequestLogFormatter());
            handler.setLevel(Level.FINEST);
            accessLogger = Logger.getAnonymousLogger();
            accessLogger.setLevel(Level.FINEST);
            accessLogger.setUseParentHandlers(false);
            accessLogger.addHandler(handler);
        } catch (IOException | SecurityException e) {
            String message = MessageFormat.format(L10N.getString("log.err.open_failed"), path);
            LOGGER.log(Level.SEVERE, message, e);
            handler = null;
            accessLogger = null;
        }
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns true if entries are actually being written.
     */
    public boolean isOpen() {
        return accessLogger != null;
    }

    @Override
    public void logRequest(String client, String summary) {
        Logger logger = accessLogger;
        if (logger != null) {
            logger.logp(Level.INFO, null, null, summary, client);
        }
    }

    @Override
    public synchronized void close() {
        if (handler != null) {
            accessLogger.removeHandler(handler);
            handler.close();
            handler = null;
            accessLogger = null;
        }
    }

}
