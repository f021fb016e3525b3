/*
 * RequestHandler.java
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

import org.bluezoo.hatch.counter.CounterUnavailableException;
import org.bluezoo.hatch.counter.VisitorCounter;
import org.bluezoo.hatch.http.file.FileStore;
import org.bluezoo.hatch.http.file.StaticPathResolver;
import org.bluezoo.hatch.log.RequestLog;
import org.bluezoo.hatch.ratelimit.ClientRateLimiter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one request into one response.
 *
 * <p>Requests are classified in this order, the first match deciding the
 * response:
 * <ol>
 * <li>request line without both method and path: 400</li>
 * <li>client over its rate limit: 429, whatever the method or path</li>
 * <li>the visitor count path: the counter is incremented and its new
 * value returned, whatever the method</li>
 * <li>{@code OPTIONS}: 204 with the CORS preflight headers</li>
 * <li>any method other than {@code GET}: 405</li>
 * <li>otherwise the static file for the path: 200, or 404 if the file is
 * missing, unreadable, or the path tries to leave the document root</li>
 * </ol>
 *
 * <p>All responses allow any origin. Successful, preflight and not found
 * responses also list the allowed methods and headers; the remaining
 * error responses do not.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RequestHandler {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatch.http.L10N");
    private static final Logger LOGGER = Logger.getLogger(RequestHandler.class.getName());

    /** Default path of the visitor counter */
    public static final String DEFAULT_VISITOR_COUNT_PATH = "/visitor-count";

    /** Default custom not found document */
    public static final String DEFAULT_NOT_FOUND_PAGE = "server_assets/404.html";

    static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";

    private static final String ANY_ORIGIN = "*";
    private static final String ALLOWED_METHODS = "GET, POST, OPTIONS";
    private static final String ALLOWED_HEADERS = "Content-Type";

    static final String RATE_LIMITED_BODY = "Rate limit exceeded";
    static final String NOT_FOUND_BODY = "404 Not Found";

    private final ClientRateLimiter rateLimiter;
    private final VisitorCounter visitorCounter;
    private final StaticPathResolver pathResolver;
    private final FileStore fileStore;
    private final RequestLog requestLog;

    private String visitorCountPath = DEFAULT_VISITOR_COUNT_PATH;
    private String notFoundPage = DEFAULT_NOT_FOUND_PAGE;

    public RequestHandler(ClientRateLimiter rateLimiter, VisitorCounter visitorCounter,
            StaticPathResolver pathResolver, FileStore fileStore, RequestLog requestLog) {
        this.rateLimiter = rateLimiter;
        this.visitorCounter = visitorCounter;
        this.pathResolver = pathResolver;
        this.fileStore = fileStore;
        this.requestLog = (requestLog != null) ? requestLog : RequestLog.NONE;
    }

    public String getVisitorCountPath() {
        return visitorCountPath;
    }

    public void setVisitorCountPath(String visitorCountPath) {
        if (visitorCountPath == null || !visitorCountPath.startsWith("/")) {
            throw new IllegalArgumentException(
                MessageFormat.format(L10N.getString("http.err.invalid_counter_path"), visitorCountPath));
        }
        this.visitorCountPath = visitorCountPath;
    }

    public String getNotFoundPage() {
        return notFoundPage;
    }

    /**
     * Sets the document served with 404 responses, or null to always send
     * the plain fallback body.
     */
    public void setNotFoundPage(String notFoundPage) {
        this.notFoundPage = (notFoundPage != null && !notFoundPage.trim().isEmpty())
                ? notFoundPage.trim()
                : null;
    }

    /**
     * Parses and answers the request read into {@code buf}.
     *
     * @param buf the buffer holding the request head
     * @param length the number of bytes read
     * @param client the client identity
     * @return the response, or null if nothing was read and no response
     * should be sent
     */
    public Response service(byte[] buf, int length, String client) {
        Request request;
        try {
            request = Request.parse(buf, length);
        } catch (MalformedRequestException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("http.malformed"),
                    client, e.getRequestLine()));
            }
            return error(HTTPStatus.BAD_REQUEST);
        }
        if (request == null) {
            return null;
        }
        LOGGER.info(MessageFormat.format(L10N.getString("http.request"),
            request.getMethod(), request.getPath(), client));
        return service(request, client);
    }

    /**
     * Answers a parsed request.
     *
     * @param request the request
     * @param client the client identity
     * @return the response
     */
    public Response service(Request request, String client) {
        if (!rateLimiter.allow(client)) {
            LOGGER.info(MessageFormat.format(L10N.getString("http.rate_limited"), client));
            return tooManyRequests();
        }

        String method = request.getMethod();
        String path = request.getPath();

        if (path.equals(visitorCountPath)) {
            return visitorCount();
        }
        if ("OPTIONS".equals(method)) {
            return preflight();
        }
        if (!"GET".equals(method)) {
            return error(HTTPStatus.METHOD_NOT_ALLOWED);
        }

        String filePath = pathResolver.resolve(path);
        if (filePath == null || StaticPathResolver.containsTraversal(filePath)) {
            return notFound();
        }

        byte[] contents;
        try {
            contents = fileStore.readFile(filePath);
        } catch (IOException e) {
            LOGGER.info(MessageFormat.format(L10N.getString("http.not_found"),
                filePath, e.toString()));
            return notFound();
        }

        Response response = new Response(HTTPStatus.OK);
        response.setBody(ContentTypes.forPath(filePath), contents);
        addCorsHeaders(response);

        LOGGER.info(MessageFormat.format(L10N.getString("http.served"), filePath));
        logRequest(client, method + " " + path + " " + HTTPStatus.OK.code);
        return response;
    }

    private Response visitorCount() {
        long count;
        try {
            count = visitorCounter.incrementAndGet();
        } catch (CounterUnavailableException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e);
            return error(HTTPStatus.INTERNAL_SERVER_ERROR);
        }
        Response response = new Response(HTTPStatus.OK);
        response.setBody("text/plain", Long.toString(count));
        addCorsHeaders(response);
        return response;
    }

    private Response preflight() {
        Response response = new Response(HTTPStatus.NO_CONTENT);
        addCorsHeaders(response);
        return response;
    }

    private Response tooManyRequests() {
        Response response = new Response(HTTPStatus.TOO_MANY_REQUESTS);
        response.setBody("text/plain", RATE_LIMITED_BODY);
        response.addHeader(ALLOW_ORIGIN, ANY_ORIGIN);
        return response;
    }

    /**
     * Returns a 404 response, with the custom not found document if it
     * can be read.
     */
    Response notFound() {
        byte[] body = null;
        if (notFoundPage != null) {
            try {
                body = fileStore.readFile(notFoundPage);
            } catch (IOException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("http.no_not_found_page"),
                        notFoundPage, e.toString()));
                }
            }
        }
        if (body == null) {
            body = NOT_FOUND_BODY.getBytes(StandardCharsets.UTF_8);
        }
        Response response = new Response(HTTPStatus.NOT_FOUND);
        response.setBody("text/html", body);
        addCorsHeaders(response);
        return response;
    }

    /**
     * Returns a small HTML error page for the given status.
     */
    static Response error(HTTPStatus status) {
        String body = "<html><body><h1>" + status.code + " " + status.reasonPhrase
                + "</h1></body></html>";
        Response response = new Response(status);
        response.setBody("text/html", body);
        response.addHeader(ALLOW_ORIGIN, ANY_ORIGIN);
        return response;
    }

    private static void addCorsHeaders(Response response) {
        response.addHeader(ALLOW_ORIGIN, ANY_ORIGIN);
        response.addHeader(ALLOW_METHODS, ALLOWED_METHODS);
        response.addHeader(ALLOW_HEADERS, ALLOWED_HEADERS);
    }

    private void logRequest(String client, String summary) {
        try {
            requestLog.logRequest(client, summary);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, L10N.getString("http.err.request_log"), e);
        }
    }

}
