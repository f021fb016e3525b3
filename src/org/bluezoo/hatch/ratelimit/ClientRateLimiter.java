/*
 * ClientRateLimiter.java
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

package org.bluezoo.hatch.ratelimit;

import java.text.MessageFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-client request rate limiter.
 *
 * <p>Each client identity (the string form of the peer IP address) owns a
 * sliding {@link RateLimiter} window. All windows live in one map guarded
 * by a single lock, so the prune, decide and record sequence for a client
 * is atomic with respect to every other caller.
 *
 * <p>If the lock cannot be acquired because the calling thread is
 * interrupted, the request is admitted. A fault in the limiter never
 * denies service on its own.
 *
 * <p>The number of tracked clients can be capped, in which case the least
 * recently seen client is forgotten first. With a scheduler, clients whose
 * window has emptied are also swept periodically.
 *
 * <h4>Example Usage</h4>
 * <pre>
 * ClientRateLimiter limiter = new ClientRateLimiter();
 * limiter.setRateLimit("100/60s");
 *
 * if (!limiter.allow(clientAddress)) {
 *     // answer 429
 * }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see RateLimiter
 */
public class ClientRateLimiter {

    private static final Logger LOGGER = Logger.getLogger(ClientRateLimiter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.ratelimit.L10N");

    /** Default maximum requests per window */
    public static final int DEFAULT_MAX_REQUESTS = 100;

    /** Default window size in milliseconds (1 minute) */
    public static final long DEFAULT_WINDOW_MS = 60000;

    /** Default cap on the number of tracked clients */
    public static final int DEFAULT_MAX_CLIENTS = 10000;

    /** Cleanup interval for empty windows (5 minutes) */
    private static final long CLEANUP_INTERVAL_MS = 300000;

    private int maxRequests = DEFAULT_MAX_REQUESTS;
    private long windowMs = DEFAULT_WINDOW_MS;
    private volatile int maxClients = DEFAULT_MAX_CLIENTS;

    private final ReentrantLock lock;
    private final Map<String, RateLimiter> windows;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cleanupTask;

    /**
     * Creates a new client rate limiter with default settings.
     */
    public ClientRateLimiter() {
        this.lock = new ReentrantLock();
        this.windows = new LinkedHashMap<String, RateLimiter>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RateLimiter> eldest) {
                int max = maxClients;
                if (max > 0 && size() > max) {
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine(MessageFormat.format(L10N.getString("ratelimit.evicted"),
                            eldest.getKey()));
                    }
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Sets the request rate limit.
     *
     * <p>Existing windows are discarded so that the new settings apply
     * to every client immediately.
     *
     * @param maxRequests the maximum requests per window
     * @param windowMs the window duration in milliseconds
     * @throws IllegalArgumentException if either value is less than 1
     */
    public void setRequestRate(int maxRequests, long windowMs) {
        if (maxRequests < 1 || windowMs < 1) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("ratelimit.err.invalid_rate"),
                    maxRequests, windowMs));
        }
        lock.lock();
        try {
            this.maxRequests = maxRequests;
            this.windowMs = windowMs;
            windows.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the request rate limit from a string specification.
     *
     * <p>Format: {@code count/duration}, where duration supports suffixes:
     * <ul>
     * <li>{@code ms} - milliseconds</li>
     * <li>{@code s} - seconds</li>
     * <li>{@code m} - minutes</li>
     * <li>{@code h} - hours</li>
     * </ul>
     * A duration without suffix is taken as milliseconds.
     *
     * <p>Examples: {@code 100/60s}, {@code 1000/1h}, {@code 50/30s}
     *
     * @param rateLimit the rate limit string
     * @throws IllegalArgumentException if the format is invalid
     */
    public void setRateLimit(String rateLimit) {
        if (rateLimit == null || rateLimit.isEmpty()) {
            return;
        }

        int slashIndex = rateLimit.indexOf('/');
        if (slashIndex == -1) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("ratelimit.err.invalid_format"), rateLimit));
        }

        try {
            int count = Integer.parseInt(rateLimit.substring(0, slashIndex).trim());
            String durationStr = rateLimit.substring(slashIndex + 1).trim().toLowerCase();
            long durationMs = parseDuration(durationStr);
            setRequestRate(count, durationMs);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("ratelimit.err.invalid_format"), rateLimit), e);
        }
    }

    /**
     * Parses a duration string with time unit suffix.
     */
    private long parseDuration(String duration) {
        long multiplier = 1;
        String numPart = duration;

        if (duration.endsWith("ms")) {
            numPart = duration.substring(0, duration.length() - 2);
        } else if (duration.endsWith("s")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 1000;
        } else if (duration.endsWith("m")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 60 * 1000;
        } else if (duration.endsWith("h")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 60 * 60 * 1000;
        }

        return Long.parseLong(numPart.trim()) * multiplier;
    }

    /**
     * Returns the maximum requests per window.
     *
     * @return the maximum requests
     */
    public int getMaxRequests() {
        return maxRequests;
    }

    /**
     * Returns the rate limit window in milliseconds.
     *
     * @return the window duration
     */
    public long getWindowMs() {
        return windowMs;
    }

    /**
     * Sets the maximum number of clients tracked at once.
     * When the cap is exceeded the least recently seen client is forgotten.
     *
     * @param maxClients the cap, or 0 for no cap
     */
    public void setMaxClients(int maxClients) {
        if (maxClients < 0) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("ratelimit.err.invalid_max_clients"), maxClients));
        }
        this.maxClients = maxClients;
    }

    /**
     * Returns the maximum number of clients tracked at once.
     *
     * @return the cap, or 0 for no cap
     */
    public int getMaxClients() {
        return maxClients;
    }

    /**
     * Decides whether a request from the given client is admitted.
     *
     * @param client the client identity
     * @return {@code true} if the request is admitted, {@code false} if the
     * client has exhausted its window
     */
    public boolean allow(String client) {
        return allow(client, System.currentTimeMillis());
    }

    /**
     * Decides whether a request from the given client is admitted at the
     * specified time.
     *
     * @param client the client identity
     * @param now the current time in milliseconds
     * @return {@code true} if the request is admitted
     */
    boolean allow(String client, long now) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning(MessageFormat.format(L10N.getString("ratelimit.fail_open"), client));
            return true;
        }
        try {
            RateLimiter window = windows.get(client);
            if (window == null) {
                window = new RateLimiter(maxRequests, windowMs);
                windows.put(client, window);
            }
            boolean admitted = window.tryAcquire(now);
            if (!admitted && LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("ratelimit.rate_exceeded"),
                    client, maxRequests, windowMs / 1000, window.getTimeUntilAvailable(now)));
            }
            return admitted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of requests the client may still make in the
     * current window.
     *
     * @param client the client identity
     * @return the remaining requests
     */
    public int getRemaining(String client) {
        lock.lock();
        try {
            RateLimiter window = windows.get(client);
            return window != null ? window.getRemaining() : maxRequests;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of clients currently tracked.
     *
     * @return the tracked client count
     */
    public int getTrackedClients() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the scheduler for background cleanup tasks.
     *
     * <p>When a scheduler is provided, clients whose window has emptied are
     * periodically forgotten, so that clients seen once do not stay in
     * memory forever.
     *
     * @param scheduler the scheduler to use
     */
    public void setScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        scheduleCleanup();
    }

    /**
     * Schedules the cleanup task.
     */
    private void scheduleCleanup() {
        if (scheduler != null && cleanupTask == null) {
            cleanupTask = scheduler.scheduleAtFixedRate(
                new CleanupTask(),
                CLEANUP_INTERVAL_MS,
                CLEANUP_INTERVAL_MS,
                TimeUnit.MILLISECONDS
            );
        }
    }

    /**
     * Cleans up empty windows.
     */
    private class CleanupTask implements Runnable {
        @Override
        public void run() {
            try {
                cleanup();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, L10N.getString("ratelimit.err.cleanup_failed"), e);
            }
        }
    }

    /**
     * Forgets every client whose window holds no admitted requests.
     *
     * @return the number of clients removed
     */
    public int cleanup() {
        return cleanup(System.currentTimeMillis());
    }

    int cleanup(long now) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, RateLimiter>> it = windows.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, RateLimiter> entry = it.next();
                if (entry.getValue().getCount(now) == 0) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }

        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("ratelimit.cleanup_complete"), removed));
        }
        return removed;
    }

    /**
     * Cancels any scheduled cleanup task.
     */
    public void shutdown() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
        }
    }
}
