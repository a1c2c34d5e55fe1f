package com.social.application.http;

/**
 * Per-route logic. Implementations are stateless and may run concurrently.
 */
@FunctionalInterface
public interface RequestHandler {

    ApiResponse handle(ApiRequest request);
}
