package com.social.application.http;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Listener-neutral response: status, content type, extra headers and raw body bytes.
 */
public record ApiResponse(
        int status,
        String contentType,
        Map<String, String> headers,
        byte[] body
) {
    public static final String APPLICATION_JSON = "application/json";

    public ApiResponse {
        Objects.requireNonNull(contentType, "contentType");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public static ApiResponse json(int status, byte[] body) {
        return new ApiResponse(status, APPLICATION_JSON, Map.of(), body);
    }

    public ApiResponse withHeader(String name, String value) {
        Map<String, String> h = new LinkedHashMap<>(headers);
        h.put(name, value);
        return new ApiResponse(status, contentType, h, body);
    }
}
