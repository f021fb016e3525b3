/*
 * StaticPathResolverTest.java
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

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link StaticPathResolver}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StaticPathResolverTest {

    private final StaticPathResolver resolver = new StaticPathResolver();

    @Test
    public void testRootIsIndex() {
        assertEquals("public_html/index.html", resolver.resolve("/"));
        assertEquals("public_html/index.html", resolver.resolve("/?utm=1"));
    }

    @Test
    public void testPlainPaths() {
        assertEquals("public_html/script.js", resolver.resolve("/script.js"));
        assertEquals("public_html/css/site.css", resolver.resolve("/css/site.css"));
        assertEquals("public_html/a/b", resolver.resolve("//a/./b"));
        assertEquals("public_html/dir", resolver.resolve("/dir/"));
    }

    @Test
    public void testQueryAndFragmentStripped() {
        assertEquals("public_html/app.js", resolver.resolve("/app.js?v=3&x=/../y"));
        assertEquals("public_html/page.html", resolver.resolve("/page.html#top"));
    }

    @Test
    public void testPercentDecoding() {
        assertEquals("public_html/my file.html", resolver.resolve("/my%20file.html"));
        assertEquals("public_html/c++.html", resolver.resolve("/c%2B+.html"));
        assertEquals("public_html/a+b", resolver.resolve("/a+b"));
    }

    @Test
    public void testTraversalRefused() {
        for (String path : Arrays.asList(
                "/..",
                "/../secret.txt",
                "/a/../../secret.txt",
                "/a/..",
                "/%2e%2e/secret.txt",
                "/%2E%2E/secret.txt",
                "/..%2Fsecret.txt",
                "/a%2Fb",
                "/a%5Cb",
                "/..\\secret.txt",
                "/a\\..\\..\\secret.txt")) {
            assertNull(path, resolver.resolve(path));
        }
    }

    @Test
    public void testDotsInNamesAllowed() {
        assertEquals("public_html/..hidden", resolver.resolve("/..hidden"));
        assertEquals("public_html/a..b/c", resolver.resolve("/a..b/c"));
        assertEquals("public_html/.well-known/x", resolver.resolve("/.well-known/x"));
    }

    @Test
    public void testNulRefused() {
        assertNull(resolver.resolve("/index.html\0.png"));
        assertNull(resolver.resolve("/index.html%00.png"));
    }

    @Test
    public void testBadEncodingRefused() {
        assertNull(resolver.resolve("/%zz"));
        assertNull(resolver.resolve("/abc%2"));
    }

    @Test
    public void testOverlongPathRefused() {
        StringBuilder buf = new StringBuilder("/");
        while (buf.length() <= StaticPathResolver.MAX_PATH_LENGTH) {
            buf.append('a');
        }
        assertNull(resolver.resolve(buf.toString()));
        assertNotNull(resolver.resolve(buf.substring(0, StaticPathResolver.MAX_PATH_LENGTH)));
    }

    @Test
    public void testEmptyRefused() {
        assertNull(resolver.resolve(""));
        assertNull(resolver.resolve(null));
    }

    @Test
    public void testRelativePathRefused() {
        assertNull(resolver.resolve("index.html"));
        assertNull(resolver.resolve("script.js?v=1"));
        assertNull(resolver.resolve("*"));
        assertNull(resolver.resolve("http://localhost/index.html"));
    }

    @Test
    public void testContainsTraversal() {
        assertTrue(StaticPathResolver.containsTraversal(".."));
        assertTrue(StaticPathResolver.containsTraversal("public_html/../x"));
        assertTrue(StaticPathResolver.containsTraversal("public_html\\..\\x"));
        assertTrue(StaticPathResolver.containsTraversal("x/.."));
        assertFalse(StaticPathResolver.containsTraversal("public_html/..x"));
        assertFalse(StaticPathResolver.containsTraversal("public_html/x.."));
        assertFalse(StaticPathResolver.containsTraversal("public_html/index.html"));
    }

    @Test
    public void testCustomRoot() {
        StaticPathResolver custom = new StaticPathResolver("site/www/", "home.htm");
        assertEquals("site/www", custom.getDocumentRoot());
        assertEquals("site/www/home.htm", custom.resolve("/"));
        assertEquals("site/www/a.css", custom.resolve("/a.css"));
    }

    @Test
    public void testInvalidConfiguration() {
        try {
            new StaticPathResolver("", "index.html");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new StaticPathResolver("public_html", " ");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new StaticPathResolver("public_html/..", "index.html");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

}
