package com.social.application.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.http.ApiErrors;
import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.application.http.RequestContext;
import com.social.application.http.RequestHandler;
import com.social.application.service.UserService;
import com.social.domain.DomainException;
import com.social.domain.user.User;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@code POST /v1/users}: 201 with the created user, 400 on bad input, 409 on duplicates,
 * 503 when the store is unreachable, 500 otherwise.
 */
public final class CreateUserHandler implements RequestHandler {

    public static final String PATH = "/v1/users";

    private final UserService users;
    private final ObjectMapper json;
    private final ApiErrors errors;

    public CreateUserHandler(UserService users, ObjectMapper json, ApiErrors errors) {
        this.users = Objects.requireNonNull(users, "users");
        this.json = Objects.requireNonNull(json, "json");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    @Override
    public ApiResponse handle(ApiRequest request) {
        RequestContext ctx = request.context();

        CreateUserRequest req;
        try {
            req = json.readValue(request.body(), CreateUserRequest.class);
        } catch (IOException e) {
            return errors.badRequest("malformed_json", ctx);
        }
        if (req == null) {
            return errors.badRequest("body_required", ctx);
        }

        Map<String, String> problems = req.validate();
        if (!problems.isEmpty()) {
            return errors.validation(problems, ctx);
        }

        User saved;
        try {
            saved = users.register(
                    req.username().trim(),
                    req.email().trim().toLowerCase(Locale.ROOT),
                    req.password(),
                    ctx
            );
        } catch (DomainException e) {
            return errors.fromDomain(e, ctx);
        }

        try {
            return ApiResponse.json(201, json.writeValueAsBytes(UserResponse.from(saved)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render user " + saved.id(), e);
        }
    }
}
