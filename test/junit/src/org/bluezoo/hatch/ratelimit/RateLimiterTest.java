/*
 * RateLimiterTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link RateLimiter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RateLimiterTest {

    @Test
    public void testBasicAcquisition() {
        RateLimiter limiter = new RateLimiter(5, 1000);
        long now = 10000;

        for (int i = 0; i < 5; i++) {
            assertTrue("Acquisition " + i + " should succeed", limiter.tryAcquire(now));
        }

        assertFalse("6th acquisition should fail", limiter.tryAcquire(now));
    }

    @Test
    public void testRejectionDoesNotConsume() {
        RateLimiter limiter = new RateLimiter(2, 1000);

        assertTrue(limiter.tryAcquire(0));
        assertTrue(limiter.tryAcquire(500));
        // Rejections at 600..900 must not extend the window
        for (long t = 600; t < 1000; t += 100) {
            assertFalse(limiter.tryAcquire(t));
        }
        // The first entry is now a full window old
        assertTrue(limiter.tryAcquire(1000));
        assertEquals(2, limiter.getCount(1000));
    }

    @Test
    public void testSlidingWindow() {
        RateLimiter limiter = new RateLimiter(3, 100);

        assertTrue(limiter.tryAcquire(0));
        assertTrue(limiter.tryAcquire(40));
        assertTrue(limiter.tryAcquire(80));
        assertFalse(limiter.tryAcquire(99));

        // Only the oldest entry has expired
        assertTrue(limiter.tryAcquire(100));
        assertFalse(limiter.tryAcquire(100));

        // Entries at 40 and 80 expire, leaving only 100
        assertTrue(limiter.tryAcquire(180));
        assertEquals(2, limiter.getCount(180));
    }

    @Test
    public void testEntryExpiresExactlyAtWindow() {
        RateLimiter limiter = new RateLimiter(1, 60000);

        assertTrue(limiter.tryAcquire(0));
        assertFalse(limiter.tryAcquire(59999));
        assertTrue(limiter.tryAcquire(60000));
    }

    @Test
    public void testExpirationOverTime() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(3, 50);
        long now = System.currentTimeMillis();

        assertTrue(limiter.tryAcquire(now));
        assertTrue(limiter.tryAcquire(now));
        assertTrue(limiter.tryAcquire(now));
        assertEquals(0, limiter.getRemaining());

        Thread.sleep(80);

        assertEquals(3, limiter.getRemaining());
    }

    @Test
    public void testGetRemaining() {
        RateLimiter limiter = new RateLimiter(5, 60000);
        long now = System.currentTimeMillis();

        assertEquals(5, limiter.getRemaining());

        limiter.tryAcquire(now);
        assertEquals(4, limiter.getRemaining());

        limiter.tryAcquire(now);
        limiter.tryAcquire(now);
        assertEquals(2, limiter.getRemaining());
    }

    @Test
    public void testTimeUntilAvailable() {
        RateLimiter limiter = new RateLimiter(2, 1000);

        assertEquals(0, limiter.getTimeUntilAvailable(0));
        limiter.tryAcquire(100);
        limiter.tryAcquire(300);
        assertEquals(800, limiter.getTimeUntilAvailable(300));
        assertEquals(0, limiter.getTimeUntilAvailable(1100));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidMaxEventsZero() {
        new RateLimiter(0, 1000);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidWindowZero() {
        new RateLimiter(1, 0);
    }

}
