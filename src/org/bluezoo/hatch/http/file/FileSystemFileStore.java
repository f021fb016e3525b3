/*
 * FileSystemFileStore.java
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
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads static files from a base directory on the local filesystem.
 * Directories are not files and are reported as missing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileSystemFileStore implements FileStore {

    private final Path basePath;

    /**
     * Creates a file store resolving paths against the working directory.
     */
    public FileSystemFileStore() {
        this(Paths.get(""));
    }

    public FileSystemFileStore(Path basePath) {
        if (basePath == null) {
            throw new IllegalArgumentException("Base path cannot be null");
        }
        this.basePath = basePath;
    }

    public Path getBasePath() {
        return basePath;
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        Path file;
        try {
            file = basePath.resolve(path);
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(path, null, e.getMessage());
        }
        if (Files.isDirectory(file)) {
            throw new NoSuchFileException(file.toString(), null, "is a directory");
        }
        return Files.readAllBytes(file);
    }

    @Override
    public String toString() {
        return "FileSystemFileStore[" + basePath.toAbsolutePath() + "]";
    }

}
