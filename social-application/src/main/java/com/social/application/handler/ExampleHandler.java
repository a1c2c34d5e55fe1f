package com.social.application.handler;

import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.application.http.RequestHandler;
import com.social.application.routing.Route;

import java.nio.charset.StandardCharsets;

/**
 * Static status endpoint: always 200 with {@code {"status":"ok"}}, whatever the request carries.
 */
public final class ExampleHandler implements RequestHandler {

    public static final String METHOD = "GET";
    public static final String PATH = "/example";

    private static final byte[] BODY = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);

    public static Route route() {
        return new Route(METHOD, PATH, new ExampleHandler());
    }

    @Override
    public ApiResponse handle(ApiRequest request) {
        return ApiResponse.json(200, BODY.clone());
    }
}
