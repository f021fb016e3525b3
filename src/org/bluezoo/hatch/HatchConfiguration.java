/*
 * HatchConfiguration.java
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
import org.bluezoo.hatch.http.file.StaticPathResolver;
import org.bluezoo.hatch.log.FileRequestLog;
import org.bluezoo.hatch.ratelimit.ClientRateLimiter;

import java.net.InetSocketAddress;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * Server settings.
 *
 * <p>Settings are read from {@code hatch.*} properties, normally the
 * system properties:
 * <pre>
 * java -Dhatch.port=8080 -Dhatch.rateLimit=50/30s org.bluezoo.hatch.Hatch
 * </pre>
 * Any property not given keeps its default.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HatchConfiguration {

    static final String PREFIX = "hatch.";

    /** Default listening port */
    public static final int DEFAULT_PORT = 8000;

    private String address = "0.0.0.0";
    private int port = DEFAULT_PORT;
    private int maxConcurrent = ConnectionDispatcher.DEFAULT_MAX_CONCURRENT;
    private String rateLimit = ClientRateLimiter.DEFAULT_MAX_REQUESTS + "/"
            + (ClientRateLimiter.DEFAULT_WINDOW_MS / 1000) + "s";
    private int maxTrackedClients = ClientRateLimiter.DEFAULT_MAX_CLIENTS;
    private String documentRoot = StaticPathResolver.DEFAULT_DOCUMENT_ROOT;
    private String indexFile = StaticPathResolver.DEFAULT_INDEX_FILE;
    private String notFoundPage = RequestHandler.DEFAULT_NOT_FOUND_PAGE;
    private String requestLog = FileRequestLog.DEFAULT_PATH;
    private int bufferSize = ConnectionDispatcher.DEFAULT_BUFFER_SIZE;
    private int readTimeout = ConnectionDispatcher.DEFAULT_READ_TIMEOUT;

    /**
     * Reads the configuration from the system properties.
     */
    public static HatchConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from the given properties.
     *
     * @param props the properties
     * @return the configuration
     * @throws IllegalArgumentException if a numeric property is not a number
     */
    public static HatchConfiguration fromProperties(Properties props) {
        HatchConfiguration config = new HatchConfiguration();
        config.setAddress(props.getProperty(PREFIX + "address", config.address));
        config.setPort(getInt(props, "port", config.port));
        config.setMaxConcurrent(getInt(props, "maxConcurrent", config.maxConcurrent));
        config.setRateLimit(props.getProperty(PREFIX + "rateLimit", config.rateLimit));
        config.setMaxTrackedClients(getInt(props, "maxTrackedClients", config.maxTrackedClients));
        config.setDocumentRoot(props.getProperty(PREFIX + "documentRoot", config.documentRoot));
        config.setIndexFile(props.getProperty(PREFIX + "indexFile", config.indexFile));
        config.setNotFoundPage(props.getProperty(PREFIX + "notFoundPage", config.notFoundPage));
        config.setRequestLog(props.getProperty(PREFIX + "requestLog", config.requestLog));
        config.setBufferSize(getInt(props, "bufferSize", config.bufferSize));
        config.setReadTimeout(getInt(props, "readTimeout", config.readTimeout));
        return config;
    }

    private static int getInt(Properties props, String name, int defaultValue) {
        String value = props.getProperty(PREFIX + name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.not_a_number"), PREFIX + name, value), e);
        }
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address.trim();
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.invalid_port"), Integer.toString(port)));
        }
        this.port = port;
    }

    /**
     * Returns the socket address to listen on.
     */
    public InetSocketAddress getListenAddress() {
        return new InetSocketAddress(address, port);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException(
                MessageFormat.format(Hatch.L10N.getString("err.invalid_max_concurrent"), maxConcurrent));
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Returns the rate limit as {@code count/duration}, e.g. {@code 100/60s}.
     */
    public String getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(String rateLimit) {
        this.rateLimit = rateLimit;
    }

    public int getMaxTrackedClients() {
        return maxTrackedClients;
    }

    public void setMaxTrackedClients(int maxTrackedClients) {
        this.maxTrackedClients = maxTrackedClients;
    }

    public String getDocumentRoot() {
        return documentRoot;
    }

    public void setDocumentRoot(String documentRoot) {
        this.documentRoot = documentRoot;
    }

    public String getIndexFile() {
        return indexFile;
    }

    public void setIndexFile(String indexFile) {
        this.indexFile = indexFile;
    }

    public String getNotFoundPage() {
        return notFoundPage;
    }

    public void setNotFoundPage(String notFoundPage) {
        this.notFoundPage = notFoundPage;
    }

    /**
     * Returns the request log file, or an empty string if request logging
     * is disabled.
     */
    public String getRequestLog() {
        return requestLog;
    }

    public void setRequestLog(String requestLog) {
        this.requestLog = (requestLog != null) ? requestLog.trim() : "";
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    @Override
    public String toString() {
        return String.format("%s:%d (max concurrent: %d, rate limit: %s, root: %s)",
                address, port, maxConcurrent, rateLimit, documentRoot);
    }

}
