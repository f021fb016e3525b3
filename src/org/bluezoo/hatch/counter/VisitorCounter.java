/*
 * VisitorCounter.java
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

package org.bluezoo.hatch.counter;

import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide visitor counter.
 *
 * <p>The count starts at zero, only ever goes up, and is not persisted.
 * Every update happens under an exclusive lock, so concurrent callers
 * never lose or duplicate an increment.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VisitorCounter {

    private static final Logger LOGGER = Logger.getLogger(VisitorCounter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.counter.L10N");

    private final ReentrantLock lock = new ReentrantLock();
    private long count;

    /**
     * Increments the counter and returns the new value.
     *
     * @return the count after this increment
     * @throws CounterUnavailableException if the calling thread was
     * interrupted while waiting for the lock
     */
    public long incrementAndGet() throws CounterUnavailableException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CounterUnavailableException(L10N.getString("counter.err.unavailable"), e);
        }
        try {
            long value = ++count;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("counter.incremented"), value));
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current count without changing it.
     */
    public long get() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

}
