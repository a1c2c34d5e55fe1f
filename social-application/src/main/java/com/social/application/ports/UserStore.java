package com.social.application.ports;

import com.social.application.http.RequestContext;
import com.social.domain.user.User;

/**
 * Persistence boundary for {@link User} records.
 *
 * Implementations classify every backend failure before it leaves the store:
 * <ul>
 *   <li>{@link com.social.domain.error.ConflictException} - duplicate username or email</li>
 *   <li>{@link com.social.domain.error.UnavailableException} - backend unreachable, timed out or deadline expired</li>
 *   <li>{@link com.social.domain.error.InternalException} - anything else</li>
 * </ul>
 */
public interface UserStore {

    /**
     * Inserts an unsaved user and returns the copy carrying the generated id and creation time.
     * The remaining time of {@code ctx} bounds the database call.
     */
    User create(User user, RequestContext ctx);
}
