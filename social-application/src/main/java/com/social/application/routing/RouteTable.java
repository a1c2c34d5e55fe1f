package com.social.application.routing;

import com.social.application.http.RequestHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable (method, path) -> route mapping.
 *
 * Populated once through {@link Builder} before the listener accepts connections; afterwards
 * it is only read, so concurrent dispatch needs no locking. Matching is exact on the path.
 */
public final class RouteTable {

    private final Map<RouteKey, Route> byKey;
    private final List<Route> routes;

    private RouteTable(Map<RouteKey, Route> registered) {
        this.byKey = Collections.unmodifiableMap(new HashMap<>(registered));
        this.routes = Collections.unmodifiableList(new ArrayList<>(registered.values()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Route> dispatch(String method, String path) {
        if (method == null || path == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(new RouteKey(method.trim().toUpperCase(Locale.ROOT), path)));
    }

    /** Routes in registration order. */
    public List<Route> routes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    public static final class Builder {
        private final Map<RouteKey, Route> registered = new LinkedHashMap<>();
        private boolean built;

        private Builder() {}

        public Builder register(Route route) {
            if (built) throw new IllegalStateException("RouteTable already built");
            RouteKey key = new RouteKey(route.method(), route.path());
            if (registered.putIfAbsent(key, route) != null) {
                throw new IllegalStateException("Duplicate route: " + route.method() + " " + route.path());
            }
            return this;
        }

        public Builder register(String method, String path, RequestHandler handler) {
            return register(new Route(method, path, handler));
        }

        public RouteTable build() {
            built = true;
            return new RouteTable(registered);
        }
    }

    private record RouteKey(String method, String path) {}
}
