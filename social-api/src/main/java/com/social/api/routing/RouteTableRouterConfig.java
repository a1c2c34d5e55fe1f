package com.social.api.routing;

import com.social.application.config.AppConfig;
import com.social.application.routing.ApiDispatcher;
import com.social.application.routing.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Registers one functional endpoint per {@link Route} of the route table. Anything else falls
 * through to Spring's own 404.
 */
@Configuration
public class RouteTableRouterConfig {

  private static final Logger log = LoggerFactory.getLogger(RouteTableRouterConfig.class);

  @Bean
  public RouterFunction<ServerResponse> apiRoutes(ApiDispatcher dispatcher, AppConfig config) {
    RouteTableAdapter adapter = new RouteTableAdapter(dispatcher, config.requestTimeout());

    RouterFunctions.Builder builder = RouterFunctions.route();
    for (Route route : dispatcher.routes().routes()) {
      builder.route(
          RequestPredicates.method(HttpMethod.valueOf(route.method()))
              .and(RequestPredicates.path(route.path())),
          request -> adapter.handle(route, request));
      log.info("Mapped {} {}", route.method(), route.path());
    }
    return builder.build();
  }
}
