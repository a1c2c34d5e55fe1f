package com.social.application.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.domain.DomainException;
import com.social.domain.error.ConflictException;
import com.social.domain.error.UnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders error responses in one JSON shape and maps the domain error taxonomy to HTTP status.
 *
 * <pre>
 * {"status":"error","reason":"...","message":"...","ts":"...","requestId":"..."}
 * </pre>
 *
 * Backend detail is logged, never returned.
 */
public final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    public static final String RETRY_AFTER = "Retry-After";

    private final ObjectMapper json;
    private final Clock clock;

    public ApiErrors(ObjectMapper json) {
        this(json, Clock.systemUTC());
    }

    public ApiErrors(ObjectMapper json, Clock clock) {
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ApiResponse badRequest(String message, RequestContext ctx) {
        return error(400, "bad_request", message, null, ctx);
    }

    public ApiResponse validation(Map<String, String> fields, RequestContext ctx) {
        return error(400, "validation_error", "invalid_request", fields, ctx);
    }

    public ApiResponse notFound(RequestContext ctx) {
        return error(404, "not_found", "no route", null, ctx);
    }

    public ApiResponse internal(RequestContext ctx) {
        return error(500, "internal_error", "internal error", null, ctx);
    }

    public ApiResponse fromDomain(DomainException ex, RequestContext ctx) {
        if (ex instanceof ConflictException conflict) {
            return error(409, "conflict", conflict.getMessage(), null, ctx);
        }
        if (ex instanceof UnavailableException) {
            log.warn("Store unavailable (requestId={}): {}", ctx.requestId(), ex.getMessage());
            return error(503, "unavailable", "service temporarily unavailable", null, ctx)
                    .withHeader(RETRY_AFTER, "1");
        }
        log.error("Internal failure (requestId={})", ctx.requestId(), ex);
        return internal(ctx);
    }

    private ApiResponse error(int status, String reason, String message, Map<String, String> fields, RequestContext ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message);
        if (fields != null) body.put("fields", fields);
        body.put("ts", clock.instant().toString());
        body.put("requestId", ctx.requestId());
        try {
            return ApiResponse.json(status, json.writeValueAsBytes(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render error body", e);
        }
    }
}
