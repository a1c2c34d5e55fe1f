package com.social.domain.user;

import java.time.Instant;
import java.util.Objects;

/**
 * Account record.
 *
 * {@code id} and {@code createdAt} belong to the store: both are null until the record
 * is persisted and never change afterwards. {@code password} holds the stored (hashed)
 * value and is kept out of {@link #toString()}.
 */
public record User(
        Long id,
        String username,
        String email,
        String password,
        Instant createdAt
) {
    public User {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
        if (username.isBlank()) throw new IllegalArgumentException("username is blank");
        if (email.isBlank()) throw new IllegalArgumentException("email is blank");
        if ((id == null) != (createdAt == null)) {
            throw new IllegalArgumentException("id and createdAt are assigned together");
        }
    }

    public static User unsaved(String username, String email, String password) {
        return new User(null, username, email, password, null);
    }

    public boolean isPersisted() {
        return id != null;
    }

    /** Copy carrying the store-generated fields. */
    public User withStoreAssigned(long id, Instant createdAt) {
        if (isPersisted()) {
            throw new IllegalStateException("user " + this.id + " is already persisted");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        return new User(id, username, email, password, createdAt);
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", username=" + username + ", email=" + email + ", createdAt=" + createdAt + "]";
    }
}
