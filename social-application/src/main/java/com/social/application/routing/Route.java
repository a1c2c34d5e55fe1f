package com.social.application.routing;

import com.social.application.http.RequestHandler;

import java.util.Locale;
import java.util.Objects;

/**
 * Binding of an HTTP method and exact path to a handler.
 */
public record Route(String method, String path, RequestHandler handler) {
    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
        method = method.trim().toUpperCase(Locale.ROOT);
        if (method.isEmpty()) throw new IllegalArgumentException("method is blank");
        if (!path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
    }
}
