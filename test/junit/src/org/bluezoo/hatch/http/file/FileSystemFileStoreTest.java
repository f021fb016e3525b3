/*
 * FileSystemFileStoreTest.java
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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link FileSystemFileStore}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileSystemFileStoreTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadsFileBytes() throws Exception {
        File file = folder.newFile("data.bin");
        byte[] content = new byte[300];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) i;
        }
        Files.write(file.toPath(), content);

        FileStore store = new FileSystemFileStore(folder.getRoot().toPath());
        assertArrayEquals(content, store.readFile("data.bin"));
    }

    @Test
    public void testReadsNestedFile() throws Exception {
        File dir = folder.newFolder("public_html", "css");
        Files.write(new File(dir, "a.css").toPath(), "body{}".getBytes("UTF-8"));

        FileStore store = new FileSystemFileStore(folder.getRoot().toPath());
        assertEquals("body{}", new String(store.readFile("public_html/css/a.css"), "UTF-8"));
    }

    @Test
    public void testEmptyFile() throws Exception {
        folder.newFile("empty.html");
        FileStore store = new FileSystemFileStore(folder.getRoot().toPath());
        assertEquals(0, store.readFile("empty.html").length);
    }

    @Test(expected = NoSuchFileException.class)
    public void testMissingFile() throws Exception {
        new FileSystemFileStore(folder.getRoot().toPath()).readFile("missing.html");
    }

    @Test(expected = NoSuchFileException.class)
    public void testDirectoryIsMissing() throws Exception {
        folder.newFolder("public_html");
        new FileSystemFileStore(folder.getRoot().toPath()).readFile("public_html");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullBasePath() {
        new FileSystemFileStore(null);
    }

}
