package com.social.application.handler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.social.domain.user.User;

import java.time.Instant;

/**
 * Outbound view of a user. There is deliberately no password component.
 */
public record UserResponse(
        long id,
        String username,
        String email,
        @JsonProperty("created_at") Instant createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.username(), user.email(), user.createdAt());
    }
}
