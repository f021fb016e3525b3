/*
 * Hatch.java
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

import org.bluezoo.hatch.counter.VisitorCounter;
import org.bluezoo.hatch.http.RequestHandler;
import org.bluezoo.hatch.http.file.FileSystemFileStore;
import org.bluezoo.hatch.http.file.StaticPathResolver;
import org.bluezoo.hatch.log.FileRequestLog;
import org.bluezoo.hatch.log.RequestLog;
import org.bluezoo.hatch.ratelimit.ClientRateLimiter;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Wires the server together from a {@link HatchConfiguration} and runs it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Hatch {

    public static final String VERSION = "1.0";

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.L10N");
    static final Logger LOGGER = Logger.getLogger(Hatch.class.getName());

    private final HatchConfiguration configuration;
    private final ClientRateLimiter rateLimiter;
    private final VisitorCounter visitorCounter;
    private final RequestLog requestLog;
    private final ScheduledExecutorService scheduler;
    private final ConnectionDispatcher dispatcher;

    /**
     * Creates the server components.
     *
     * @param configuration the settings
     * @throws IllegalArgumentException if a setting is invalid
     */
    public Hatch(HatchConfiguration configuration) {
        this.configuration = configuration;

        rateLimiter = new ClientRateLimiter();
        rateLimiter.setRateLimit(configuration.getRateLimit());
        rateLimiter.setMaxClients(configuration.getMaxTrackedClients());

        visitorCounter = new VisitorCounter();

        StaticPathResolver pathResolver = new StaticPathResolver(
                configuration.getDocumentRoot(), configuration.getIndexFile());

        String logPath = configuration.getRequestLog();
        requestLog = logPath.isEmpty() ? RequestLog.NONE : new FileRequestLog(logPath);

        RequestHandler requestHandler = new RequestHandler(rateLimiter, visitorCounter,
                pathResolver, new FileSystemFileStore(), requestLog);
        requestHandler.setNotFoundPage(configuration.getNotFoundPage());

        dispatcher = new ConnectionDispatcher(requestHandler);
        dispatcher.setBufferSize(configuration.getBufferSize());
        dispatcher.setReadTimeout(configuration.getReadTimeout());

        scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("hatch-ratelimit-cleanup"));
        rateLimiter.setScheduler(scheduler);
    }

    public HatchConfiguration getConfiguration() {
        return configuration;
    }

    public VisitorCounter getVisitorCounter() {
        return visitorCounter;
    }

    public ConnectionDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Binds the listening socket and accepts connections until
     * {@link #shutdown} is called.
     *
     * @throws IOException if the listening socket cannot be bound
     */
    public void run() throws IOException {
        dispatcher.run(configuration.getListenAddress(), configuration.getMaxConcurrent());
    }

    /**
     * Stops accepting connections and releases resources.
     */
    public void shutdown() {
        LOGGER.info(L10N.getString("info.shutting_down"));
        dispatcher.close();
        rateLimiter.shutdown();
        scheduler.shutdown();
        requestLog.close();
    }

    private class ShutdownHook extends Thread {
        ShutdownHook() {
            super("hatch-shutdown");
        }

        @Override
        public void run() {
            shutdown();
        }
    }

    /**
     * Loads the bundled logging configuration unless one was given with
     * {@code java.util.logging.config.file}.
     */
    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null) {
            return;
        }
        InputStream in = Hatch.class.getResourceAsStream("logging.properties");
        if (in == null) {
            return;
        }
        try {
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, L10N.getString("err.logging_config"), e);
        } finally {
            try {
                in.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, L10N.getString("err.close"), e);
            }
        }
    }

    // -- Main entry point --

    public static void main(String[] args) {
        configureLogging();

        Hatch hatch;
        try {
            hatch = new Hatch(HatchConfiguration.fromSystemProperties());
        } catch (IllegalArgumentException e) {
            System.err.println(MessageFormat.format(L10N.getString("err.configuration"), e.getMessage()));
            System.exit(2);
            return;
        }

        Runtime.getRuntime().addShutdownHook(hatch.new ShutdownHook());

        System.out.println(MessageFormat.format(L10N.getString("banner"), VERSION,
                Integer.toString(hatch.getConfiguration().getPort())));
        try {
            hatch.run();
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, MessageFormat.format(L10N.getString("err.bind"),
                hatch.getConfiguration().getListenAddress()), e);
            System.exit(1);
        }

        LOGGER.info(L10N.getString("info.hatch_end_loop"));
    }

}
