/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.osdn.kubernetes.master.management;

import java.io.IOException;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Guards the management endpoints, which only ever serve {@code GET}.
 * <p>
 * Any other method is answered with <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>
 * and an {@code Allow: GET} header, without reading the request body.
 */
public class UnsupportedHttpMethodFilter extends Filter {

    public static final Filter INSTANCE = new UnsupportedHttpMethodFilter();

    private UnsupportedHttpMethodFilter() {
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            chain.doFilter(exchange);
            return;
        }
        try (exchange) {
            // request body left unread
            exchange.getResponseHeaders().add("Allow", "GET");
            exchange.sendResponseHeaders(405, -1);
        }
    }

    @Override
    public String description() {
        return "Rejects methods other than GET";
    }
}
