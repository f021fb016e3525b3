/*
 * StaticPathResolver.java
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

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps request paths onto file paths below the document root.
 *
 * <p>The root path {@code /} maps to the index document. Any other path
 * has its query and fragment removed, is split into {@code /}-separated
 * components, each component is percent-decoded, and the components are
 * appended to the document root.
 *
 * <p>A path is refused, and {@link #resolve} returns null, when it does
 * not start with {@code /}, when any component is {@code ..} (before or after decoding), when a decoded
 * component contains a separator or a NUL, or when the path is
 * unreasonably long. Callers answer a refused path exactly as they answer
 * a missing file.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StaticPathResolver {

    private static final Logger LOGGER = Logger.getLogger(StaticPathResolver.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.http.file.L10N");

    /** Default document root */
    public static final String DEFAULT_DOCUMENT_ROOT = "public_html";

    /** Default index document */
    public static final String DEFAULT_INDEX_FILE = "index.html";

    static final int MAX_PATH_LENGTH = 2048;

    private final String documentRoot;
    private final String indexFile;

    public StaticPathResolver() {
        this(DEFAULT_DOCUMENT_ROOT, DEFAULT_INDEX_FILE);
    }

    /**
     * @param documentRoot the prefix prepended to every request path
     * @param indexFile the document served for {@code /}
     */
    public StaticPathResolver(String documentRoot, String indexFile) {
        if (documentRoot == null || documentRoot.trim().isEmpty()) {
            throw new IllegalArgumentException(L10N.getString("file.err.no_document_root"));
        }
        if (indexFile == null || indexFile.trim().isEmpty()) {
            throw new IllegalArgumentException(L10N.getString("file.err.no_index_file"));
        }
        String root = documentRoot.trim();
        while (root.length() > 1 && root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        if (containsTraversal(root) || containsTraversal(indexFile.trim())) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("file.err.traversal_in_config"), root, indexFile));
        }
        this.documentRoot = root;
        this.indexFile = indexFile.trim();
    }

    public String getDocumentRoot() {
        return documentRoot;
    }

    public String getIndexFile() {
        return indexFile;
    }

    /**
     * Resolves a request path to a file path.
     *
     * @param requestPath the request-target
     * @return the relative file path, or null if the path is refused
     */
    public String resolve(String requestPath) {
        if (requestPath == null || requestPath.isEmpty() || requestPath.charAt(0) != '/') {
            return null;
        }
        if (requestPath.length() > MAX_PATH_LENGTH) {
            LOGGER.warning(L10N.getString("file.rejected_long_path"));
            return null;
        }
        if (requestPath.indexOf('\0') >= 0) {
            LOGGER.warning(L10N.getString("file.rejected_null_byte"));
            return null;
        }

        String path = stripQuery(requestPath);
        if ("/".equals(path)) {
            return documentRoot + "/" + indexFile;
        }

        StringBuilder buf = new StringBuilder(documentRoot);
        int compStart = 0;
        int pathLen = path.length();
        while (compStart <= pathLen) {
            int compEnd = nextSeparator(path, compStart);
            if (compEnd < 0) {
                compEnd = pathLen;
            }
            String component = path.substring(compStart, compEnd);
            compStart = compEnd + 1;

            if (component.isEmpty() || ".".equals(component)) {
                continue;
            }
            if ("..".equals(component)) {
                blocked(requestPath);
                return null;
            }

            String decoded = decode(component);
            if (decoded == null
                    || "..".equals(decoded)
                    || decoded.indexOf('/') >= 0
                    || decoded.indexOf('\\') >= 0
                    || decoded.indexOf('\0') >= 0) {
                blocked(requestPath);
                return null;
            }
            if (".".equals(decoded)) {
                continue;
            }
            buf.append('/').append(decoded);
        }
        return buf.toString();
    }

    /**
     * Returns true if the path contains a {@code ..} component, with either
     * separator.
     */
    public static boolean containsTraversal(String path) {
        int compStart = 0;
        int pathLen = path.length();
        while (compStart <= pathLen) {
            int compEnd = nextSeparator(path, compStart);
            if (compEnd < 0) {
                compEnd = pathLen;
            }
            if (compEnd - compStart == 2 && path.startsWith("..", compStart)) {
                return true;
            }
            compStart = compEnd + 1;
        }
        return false;
    }

    private static int nextSeparator(String path, int from) {
        int slash = path.indexOf('/', from);
        int backslash = path.indexOf('\\', from);
        if (slash < 0) {
            return backslash;
        }
        if (backslash < 0) {
            return slash;
        }
        return Math.min(slash, backslash);
    }

    private static String stripQuery(String path) {
        int end = path.length();
        int query = path.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return path.substring(0, end);
    }

    private static String decode(String component) {
        if (component.indexOf('%') < 0) {
            return component;
        }
        try {
            // a literal plus sign in a path is not a space
            return URLDecoder.decode(component.replace("+", "%2B"), "UTF-8");
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("file.bad_encoding"), component));
            }
            return null;
        }
    }

    private void blocked(String requestPath) {
        LOGGER.info(MessageFormat.format(L10N.getString("file.blocked_traversal"), requestPath));
    }

}
