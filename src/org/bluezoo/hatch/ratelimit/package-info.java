/*
 * package-info.java
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

/**
 * Per-client request rate limiting.
 *
 * <h2>Components</h2>
 *
 * <h3>{@link org.bluezoo.hatch.ratelimit.RateLimiter}</h3>
 * <p>A single sliding window: at most N requests within any trailing
 * interval of the window duration. Rejected requests are not counted.</p>
 *
 * <h3>{@link org.bluezoo.hatch.ratelimit.ClientRateLimiter}</h3>
 * <p>One window per client identity, all behind a single lock, with:
 * <ul>
 * <li>a cap on the number of tracked clients (least recently seen
 * evicted first)</li>
 * <li>periodic removal of clients whose window is empty</li>
 * <li>fail-open behaviour if the lock cannot be taken</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <pre>
 * -Dhatch.rateLimit=100/60s
 * -Dhatch.maxTrackedClients=10000
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hatch.ratelimit;
