package com.social.domain.error;

import com.social.domain.DomainException;

/**
 * Any other backend failure (bad query, schema mismatch). Not expected in normal operation.
 */
public final class InternalException extends DomainException {

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
