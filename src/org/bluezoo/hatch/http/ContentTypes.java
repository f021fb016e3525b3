/*
 * ContentTypes.java
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

package org.bluezoo.hatch.http;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to the Content-Type they are served with.
 * Anything not listed is served as {@code application/octet-stream}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContentTypes {

    /** Content-Type for unknown extensions. */
    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String,String> COMMON = new HashMap<>();
    static {
        COMMON.put("html", "text/html");
        COMMON.put("css", "text/css");
        COMMON.put("js", "application/javascript");
        COMMON.put("png", "image/png");
        COMMON.put("jpg", "image/jpeg");
        COMMON.put("jpeg", "image/jpeg");
        COMMON.put("gif", "image/gif");
        COMMON.put("svg", "image/svg+xml");
        COMMON.put("ico", "image/x-icon");
    }

    private ContentTypes() {
    }

    /**
     * Returns the Content-Type for the given extension, or null if the
     * extension is not known.
     */
    public static String getContentType(String extension) {
        if (extension == null) {
            return null;
        }
        return COMMON.get(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the Content-Type for the file at the given path, based on
     * the extension of its last component.
     */
    public static String forPath(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash) {
            return DEFAULT;
        }
        String contentType = getContentType(path.substring(dot + 1));
        return (contentType != null) ? contentType : DEFAULT;
    }

}
