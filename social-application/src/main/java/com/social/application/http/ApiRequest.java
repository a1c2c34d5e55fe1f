package com.social.application.http;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Listener-neutral view of an inbound request. Header names are case-insensitive.
 */
public record ApiRequest(
        String method,
        String path,
        Map<String, String> headers,
        byte[] body,
        RequestContext context
) {
    public ApiRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(context, "context");

        TreeMap<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) h.putAll(headers);
        headers = Collections.unmodifiableMap(h);
        body = body == null ? new byte[0] : body;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
