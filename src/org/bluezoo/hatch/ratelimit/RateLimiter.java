/*
 * RateLimiter.java
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

/**
 * The sliding window of admitted requests for a single client.
 *
 * <p>Admission timestamps are kept, oldest first, in a circular buffer
 * whose capacity is the maximum number of requests per window. An entry
 * is pruned once it is a full window old, and pruning happens lazily on
 * each access rather than on a timer. A rejected request leaves no trace
 * in the window.
 *
 * <p>This class is not thread-safe. {@link ClientRateLimiter} only
 * touches a window while holding its own lock.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ClientRateLimiter
 */
public class RateLimiter {

    private final long[] timestamps;
    private final long windowMs;
    private int index;
    private int count;

    /**
     * Creates a new window.
     *
     * @param maxEvents the maximum number of requests admitted within the window
     * @param windowMs the window duration in milliseconds
     * @throws IllegalArgumentException if maxEvents is less than 1 or windowMs is less than 1
     */
    public RateLimiter(int maxEvents, long windowMs) {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be at least 1");
        }
        if (windowMs < 1) {
            throw new IllegalArgumentException("windowMs must be at least 1");
        }
        this.timestamps = new long[maxEvents];
        this.windowMs = windowMs;
        this.index = 0;
        this.count = 0;
    }

    /**
     * Attempts to admit a request at the specified time.
     *
     * <p>If the window still has room the timestamp is recorded and
     * {@code true} is returned. Otherwise nothing is recorded.
     *
     * @param now the current time in milliseconds
     * @return {@code true} if the request is admitted, {@code false} if rate limited
     */
    boolean tryAcquire(long now) {
        expireOldEntries(now);

        if (count >= timestamps.length) {
            return false;
        }

        timestamps[index] = now;
        index = (index + 1) % timestamps.length;
        count++;
        return true;
    }

    int getCount(long now) {
        expireOldEntries(now);
        return count;
    }

    /**
     * Returns the number of requests that may still be admitted in the
     * current window.
     *
     * @return the remaining permits
     */
    public int getRemaining() {
        expireOldEntries(System.currentTimeMillis());
        return timestamps.length - count;
    }

    /**
     * Returns the time in milliseconds until the next request would be
     * admitted.
     *
     * @param now the current time in milliseconds
     * @return milliseconds until a permit is available, or 0 if one is available now
     */
    long getTimeUntilAvailable(long now) {
        expireOldEntries(now);

        if (count < timestamps.length) {
            return 0;
        }

        int oldestIdx = (index - count + timestamps.length) % timestamps.length;
        long expiryTime = timestamps[oldestIdx] + windowMs;
        return Math.max(0, expiryTime - now);
    }

    /**
     * Prunes entries that are a full window old or older.
     */
    private void expireOldEntries(long now) {
        long cutoff = now - windowMs;
        while (count > 0) {
            int oldestIdx = (index - count + timestamps.length) % timestamps.length;
            if (timestamps[oldestIdx] <= cutoff) {
                count--;
            } else {
                break;
            }
        }
    }

}
