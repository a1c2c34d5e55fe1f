package com.social.api.routing;

import com.social.api.tracing.RequestIdFilter;
import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.application.http.RequestContext;
import com.social.application.routing.ApiDispatcher;
import com.social.application.routing.Route;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Bridges Spring's functional endpoints to listener-neutral {@link Route} handlers.
 */
final class RouteTableAdapter {

  private final ApiDispatcher dispatcher;
  private final Duration requestTimeout;

  RouteTableAdapter(ApiDispatcher dispatcher, Duration requestTimeout) {
    this.dispatcher = dispatcher;
    this.requestTimeout = requestTimeout;
  }

  ServerResponse handle(Route route, ServerRequest request) throws IOException {
    String requestId = MDC.get(RequestIdFilter.MDC_REQUEST_ID);
    if (requestId == null) requestId = UUID.randomUUID().toString();

    byte[] body = request.servletRequest().getInputStream().readAllBytes();
    Map<String, String> headers = request.headers().asHttpHeaders().toSingleValueMap();

    ApiResponse res = dispatcher.invoke(route, new ApiRequest(
        request.method().name(),
        request.path(),
        headers,
        body,
        RequestContext.start(requestId, requestTimeout)
    ));

    return ServerResponse.status(res.status())
        .contentType(MediaType.parseMediaType(res.contentType()))
        .headers(h -> res.headers().forEach(h::set))
        .body(res.body());
  }
}
