package com.social.standalone.server;

import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.application.http.RequestContext;
import com.social.application.routing.ApiDispatcher;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single catch-all context: every exchange goes through {@link ApiDispatcher#dispatch}, so
 * unregistered (method, path) pairs get the dispatcher's 404.
 */
final class RouteTableHttpHandler implements HttpHandler {

    static final String HDR_REQUEST_ID = "X-Request-Id";
    static final String MDC_REQUEST_ID = "requestId";

    private static final int MAX_REQUEST_ID_LENGTH = 128;

    private final ApiDispatcher dispatcher;
    private final Duration requestTimeout;

    RouteTableHttpHandler(ApiDispatcher dispatcher, Duration requestTimeout) {
        this.dispatcher = dispatcher;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String requestId = requestId(exchange.getRequestHeaders());
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            byte[] body;
            try (InputStream in = exchange.getRequestBody()) {
                body = in.readAllBytes();
            }

            ApiResponse res = dispatcher.dispatch(new ApiRequest(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    firstValues(exchange.getRequestHeaders()),
                    body,
                    RequestContext.start(requestId, requestTimeout)
            ));

            Headers out = exchange.getResponseHeaders();
            out.set("Content-Type", res.contentType());
            out.set(HDR_REQUEST_ID, requestId);
            res.headers().forEach(out::set);

            byte[] payload = res.body();
            exchange.sendResponseHeaders(res.status(), payload.length == 0 ? -1 : payload.length);
            if (payload.length > 0) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(payload);
                }
            }
        } finally {
            exchange.close();
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private static String requestId(Headers headers) {
        String given = headers.getFirst(HDR_REQUEST_ID);
        if (given == null || given.isBlank() || given.length() > MAX_REQUEST_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return given.trim();
    }

    private static Map<String, String> firstValues(Headers headers) {
        Map<String, String> flat = new HashMap<>();
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() != null && !e.getValue().isEmpty()) {
                flat.put(e.getKey(), e.getValue().get(0));
            }
        }
        return flat;
    }
}
