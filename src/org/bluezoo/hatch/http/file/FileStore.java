/*
 * FileStore.java
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

package org.bluezoo.hatch.http.file;

import java.io.IOException;

/**
 * Source of static file content.
 *
 * <p>Paths are relative, {@code /}-separated and never contain a
 * {@code ..} component.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface FileStore {

    /**
     * Reads the whole content of the file at the given path.
     *
     * @param path the resolved relative path
     * @return the file content
     * @throws java.nio.file.NoSuchFileException if there is no such file
     * @throws IOException if the file exists but cannot be read
     */
    byte[] readFile(String path) throws IOException;

}
