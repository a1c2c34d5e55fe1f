package com.social.application.handler;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /v1/users}.
 */
public record CreateUserRequest(String username, String email, String password) {

    static final int MAX_NAME_LENGTH = 255;
    // BCrypt only looks at the first 72 bytes
    static final int MAX_PASSWORD_BYTES = 72;

    /** Field -> problem; empty when the request is acceptable. */
    Map<String, String> validate() {
        Map<String, String> fields = new LinkedHashMap<>();
        checkName(fields, "username", username);
        checkName(fields, "email", email);
        if (email != null && !email.isBlank() && email.trim().indexOf('@') <= 0) {
            fields.put("email", "invalid");
        }
        if (password == null || password.isBlank()) {
            fields.put("password", "required");
        } else if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            fields.put("password", "too_long");
        }
        return fields;
    }

    private static void checkName(Map<String, String> fields, String name, String value) {
        if (value == null || value.isBlank()) {
            fields.put(name, "required");
        } else if (value.trim().length() > MAX_NAME_LENGTH) {
            fields.put(name, "too_long");
        }
    }
}
