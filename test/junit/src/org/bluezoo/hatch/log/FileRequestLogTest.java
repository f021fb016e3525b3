/*
 * FileRequestLogTest.java
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

package org.bluezoo.hatch.log;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link FileRequestLog} and {@link RequestLogFormatter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileRequestLogTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testWritesEntries() throws Exception {
        File file = new File(folder.getRoot(), "server.log");
        FileRequestLog log = new FileRequestLog(file.getPath());
        assertTrue(log.isOpen());
        log.logRequest("127.0.0.1", "GET /index.html 200");
        log.logRequest("10.1.2.3", "GET /script.js 200");
        log.close();
        assertFalse(log.isOpen());

        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0), lines.get(0).matches("\\[\\d+\\.\\d{9}\\] 127\\.0\\.0\\.1 - GET /index\\.html 200"));
        assertTrue(lines.get(1), lines.get(1).endsWith("] 10.1.2.3 - GET /script.js 200"));
    }

    @Test
    public void testAppendsToExistingLog() throws Exception {
        File file = new File(folder.getRoot(), "server.log");
        Files.write(file.toPath(), ("[1.000000000] old - GET / 200" + System.lineSeparator())
                .getBytes(StandardCharsets.UTF_8));

        FileRequestLog log = new FileRequestLog(file.getPath());
        log.logRequest("127.0.0.1", "GET / 200");
        log.close();

        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("[1.000000000] old - GET / 200", lines.get(0));
    }

    @Test
    public void testMessageUsedVerbatim() throws Exception {
        File file = new File(folder.getRoot(), "server.log");
        FileRequestLog log = new FileRequestLog(file.getPath());
        log.logRequest("127.0.0.1", "GET /{0}'x' 200");
        log.close();

        String content = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        assertTrue(content, content.contains("127.0.0.1 - GET /{0}'x' 200"));
    }

    @Test
    public void testUnopenableLogIsDisabled() {
        File file = new File(folder.getRoot(), "no/such/dir/server.log");
        FileRequestLog log = new FileRequestLog(file.getPath());
        assertFalse(log.isOpen());
        log.logRequest("127.0.0.1", "GET / 200");
        log.close();
        assertFalse(file.exists());
    }

    @Test
    public void testFormatTimestamp() {
        assertEquals("1700000000.000000005",
                RequestLogFormatter.formatTimestamp(Instant.ofEpochSecond(1700000000L, 5)));
        assertEquals("0.123456789",
                RequestLogFormatter.formatTimestamp(Instant.ofEpochSecond(0, 123456789)));
    }

    @Test
    public void testFormatterWithoutClient() {
        LogRecord record = new LogRecord(Level.INFO, "GET / 200");
        record.setInstant(Instant.ofEpochSecond(10, 0));
        assertEquals("[10.000000000] unknown - GET / 200" + RequestLogFormatter.EOL,
                new RequestLogFormatter().format(record));
    }

}
