package com.social.application.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.application.config.AppConfig;
import com.social.application.http.ApiRequest;
import com.social.application.http.ApiResponse;
import com.social.application.http.RequestHandler;

import java.util.LinkedHashMap;
import java.util.Map;

public final class HealthHandler implements RequestHandler {

    public static final String PATH = "/v1/health";

    private final byte[] body;

    public HealthHandler(AppConfig config, ObjectMapper json) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "ok");
        m.put("service", config.serviceName());
        m.put("env", config.envName());
        m.put("version", AppConfig.VERSION);
        try {
            this.body = json.writeValueAsBytes(m);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render health body", e);
        }
    }

    @Override
    public ApiResponse handle(ApiRequest request) {
        return ApiResponse.json(200, body.clone());
    }
}
