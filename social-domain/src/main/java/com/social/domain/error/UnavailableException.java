package com.social.domain.error;

import com.social.domain.DomainException;

/**
 * The backing store could not be reached in time (connection failure, pool exhaustion,
 * timeout or an expired request deadline). Callers may retry.
 */
public final class UnavailableException extends DomainException {

    public UnavailableException(String message) {
        super(message);
    }

    public UnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
