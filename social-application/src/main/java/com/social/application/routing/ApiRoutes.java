package com.social.application.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.config.AppConfig;
import com.social.application.handler.CreateUserHandler;
import com.social.application.handler.ExampleHandler;
import com.social.application.handler.HealthHandler;
import com.social.application.http.ApiErrors;
import com.social.application.service.UserService;

/**
 * The service's route set, shared by both entry points.
 */
public final class ApiRoutes {

    private ApiRoutes() {}

    public static RouteTable create(AppConfig config, UserService users, ObjectMapper json, ApiErrors errors) {
        return RouteTable.builder()
                .register(ExampleHandler.route())
                .register("GET", HealthHandler.PATH, new HealthHandler(config, json))
                .register("POST", CreateUserHandler.PATH, new CreateUserHandler(users, json, errors))
                .build();
    }
}
