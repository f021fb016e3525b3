/*
 * DaemonThreadFactory.java
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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates numbered daemon threads, so that they can be told apart in the
 * logs and never keep the JVM alive on their own.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class DaemonThreadFactory implements ThreadFactory {

    private final String name;
    private final AtomicInteger counter = new AtomicInteger(0);

    DaemonThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
    }

}
