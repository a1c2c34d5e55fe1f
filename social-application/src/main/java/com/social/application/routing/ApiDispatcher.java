package com.social.application.routing;

import com.social.application.http.ApiErrors;
import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.domain.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs requests against a {@link RouteTable}. Unknown (method, path) pairs yield 404;
 * failures escaping a handler are mapped here so nothing reaches the listener raw.
 */
public final class ApiDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ApiDispatcher.class);

    private final RouteTable routes;
    private final ApiErrors errors;

    public ApiDispatcher(RouteTable routes, ApiErrors errors) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public RouteTable routes() {
        return routes;
    }

    public ApiResponse dispatch(ApiRequest request) {
        return routes.dispatch(request.method(), request.path())
                .map(route -> invoke(route, request))
                .orElseGet(() -> errors.notFound(request.context()));
    }

    public ApiResponse invoke(Route route, ApiRequest request) {
        try {
            return route.handler().handle(request);
        } catch (DomainException e) {
            return errors.fromDomain(e, request.context());
        } catch (RuntimeException e) {
            log.error("Handler failed for {} {} (requestId={})",
                    route.method(), route.path(), request.context().requestId(), e);
            return errors.internal(request.context());
        }
    }
}
