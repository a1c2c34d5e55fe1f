package com.social.application.service;

import com.social.application.http.RequestContext;
import com.social.application.ports.PasswordHasher;
import com.social.application.ports.UserStore;
import com.social.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserStore store;
    private final PasswordHasher hasher;

    public UserService(UserStore store, PasswordHasher hasher) {
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    /**
     * Hashes the password and inserts the user. Store errors propagate already classified.
     */
    public User register(String username, String email, String rawPassword, RequestContext ctx) {
        User saved = store.create(User.unsaved(username, email, hasher.hash(rawPassword)), ctx);
        log.info("Created user id={} username={}", saved.id(), saved.username());
        return saved;
    }
}
